package com.ssomonitor.detection.client;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.ScreenshotException;
import com.ssomonitor.detection.util.ProcessOutputPump;
import com.ssomonitor.detection.util.UrlHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Captures screenshots with an external browser script invoked as {@code <command...> <url> <output-file>}.
 * Files are written to {@code <directory>/<strategy>/<sanitized-url>_<uuid>.png}.
 */
@Component
@Slf4j
public class CommandScreenshotCapturer implements ScreenshotCapturer {

    private final List<String> command;
    private final Path directory;
    private final Duration timeout;

    @Autowired
    public CommandScreenshotCapturer(WorkerProperties properties) {
        this(properties.getScreenshot().getCommand(),
                Path.of(properties.getScreenshot().getDirectory()),
                properties.getScreenshot().getTimeout());
    }

    public CommandScreenshotCapturer(List<String> command, Path directory, Duration timeout) {
        this.command = List.copyOf(command);
        this.directory = directory;
        this.timeout = timeout;
    }

    @Override
    public Path capture(String url, LoginPageStrategyType strategy) {
        Path target = directory.resolve(strategy.getScreenshotDirectory())
                .resolve(UrlHelper.sanitizeForFilename(url) + "_" + UUID.randomUUID() + ".png")
                .toAbsolutePath();

        List<String> args = new ArrayList<>(command);
        args.add(url);
        args.add(target.toString());

        Process process;
        try {
            Files.createDirectories(target.getParent());
            process = new ProcessBuilder(args).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ScreenshotException("Could not start screenshot command for " + url + ": " + e.getMessage(), e);
        }
        ProcessOutputPump.start(process, "screenshot");

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw ScreenshotException.timedOut(url);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ScreenshotException("Interrupted while capturing " + url, e);
        }

        if (process.exitValue() != 0) {
            throw ScreenshotException.exitStatus(url, process.exitValue());
        }
        if (!Files.isRegularFile(target)) {
            throw ScreenshotException.missingFile(url, target.toString());
        }
        log.debug("Screenshot of {} saved at {}", url, target);
        return target;
    }
}
