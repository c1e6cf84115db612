package com.ssomonitor.detection.service.strategy;

import java.nio.file.Path;

/**
 * Headless-browser crawler that clicks through a site and leaves screenshots and action logs behind.
 */
public interface ExternalCrawler {

    /**
     * Crawls starting at {@code url} and returns once the crawler has finished.
     */
    CrawlRun run(String url);

    /**
     * @param rawDirectory        every flow the crawler recorded: screenshots and action logs
     * @param classifiedDirectory screenshots the triage service classified as login pages, same layout
     */
    record CrawlRun(int exitStatus, Path rawDirectory, Path classifiedDirectory) {

        public boolean isSuccess() {
            return exitStatus == 0;
        }
    }
}
