package com.ssomonitor.detection.exception;

/**
 * The external crawler could not be started or exited unsuccessfully.
 */
public class CrawlerProcessException extends WorkerException {

    private final int exitStatus;

    public CrawlerProcessException(String message, int exitStatus) {
        super("CRAWLER_ERROR", message);
        this.exitStatus = exitStatus;
    }

    public CrawlerProcessException(String message, Throwable cause) {
        super("CRAWLER_ERROR", message, cause);
        this.exitStatus = -1;
    }

    public static CrawlerProcessException nonZeroExit(String url, int exitStatus) {
        return new CrawlerProcessException("Crawler exited with status " + exitStatus + " for " + url, exitStatus);
    }

    public static CrawlerProcessException launchFailed(String url, Throwable cause) {
        return new CrawlerProcessException("Crawler could not be started for " + url + ": " + cause.getMessage(), cause);
    }

    public int getExitStatus() {
        return exitStatus;
    }
}
