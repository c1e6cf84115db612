package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.exception.CrawlerProcessException;
import com.ssomonitor.detection.util.ProcessOutputPump;
import com.ssomonitor.detection.util.UrlHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the crawler script as {@code <command...> <url>}, streaming its output into the log.
 * A non-zero exit status is raised as {@link CrawlerProcessException}.
 */
@Component
@Slf4j
public class SubprocessExternalCrawler implements ExternalCrawler {

    private final List<String> command;
    private final Path workingDirectory;
    private final Path rawRoot;
    private final Path classifiedRoot;

    @Autowired
    public SubprocessExternalCrawler(WorkerProperties properties) {
        this(properties.getCrawler().getCommand(),
                Path.of(properties.getCrawler().getWorkingDirectory()),
                Path.of(properties.getCrawler().getRawDirectory()),
                Path.of(properties.getCrawler().getClassifiedDirectory()));
    }

    public SubprocessExternalCrawler(List<String> command, Path workingDirectory, Path rawRoot, Path classifiedRoot) {
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory.toAbsolutePath();
        this.rawRoot = this.workingDirectory.resolve(rawRoot);
        this.classifiedRoot = this.workingDirectory.resolve(classifiedRoot);
    }

    @Override
    public CrawlRun run(String url) {
        List<String> args = new ArrayList<>(command);
        args.add(url);
        log.info("Starting crawling login page detection for url: {}", url);

        Process process;
        try {
            process = new ProcessBuilder(args)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw CrawlerProcessException.launchFailed(url, e);
        }
        Thread pump = ProcessOutputPump.start(process, "crawler");

        int exitStatus;
        try {
            exitStatus = process.waitFor();
            pump.join(5_000);
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CrawlerProcessException("Interrupted while crawling " + url, e);
        }

        if (exitStatus != 0) {
            log.error("Crawler exited with status {} for {}", exitStatus, url);
            throw CrawlerProcessException.nonZeroExit(url, exitStatus);
        }
        log.info("Crawler finished for {}", url);

        String site = UrlHelper.siteDirectoryName(url);
        return new CrawlRun(exitStatus, rawRoot.resolve(site), classifiedRoot.resolve(site));
    }
}
