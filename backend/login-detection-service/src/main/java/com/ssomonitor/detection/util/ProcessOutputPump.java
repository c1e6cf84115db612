package com.ssomonitor.detection.util;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Copies the merged output of a child process into the log, line by line, as it is produced.
 */
@Slf4j
public class ProcessOutputPump implements Runnable {

    private final InputStream stream;
    private final String prefix;
    private final Map<String, String> mdc;

    private ProcessOutputPump(InputStream stream, String prefix) {
        this.stream = stream;
        this.prefix = prefix;
        this.mdc = MDC.getCopyOfContextMap();
    }

    /**
     * Starts a daemon thread draining {@code process}' stdout; stderr must be redirected into it.
     */
    public static Thread start(Process process, String prefix) {
        Thread thread = new Thread(new ProcessOutputPump(process.getInputStream(), prefix), prefix + "-output");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[{}] {}", prefix, line);
            }
        } catch (IOException e) {
            log.debug("[{}] output stream closed: {}", prefix, e.getMessage());
        } finally {
            MDC.clear();
        }
    }
}
