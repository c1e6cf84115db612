package com.ssomonitor.detection.exception;

/**
 * Screenshot capture failed for a single URL.
 */
public class ScreenshotException extends WorkerException {

    public ScreenshotException(String message) {
        super("SCREENSHOT_ERROR", message);
    }

    public ScreenshotException(String message, Throwable cause) {
        super("SCREENSHOT_ERROR", message, cause);
    }

    public static ScreenshotException exitStatus(String url, int status) {
        return new ScreenshotException("Screenshot command exited with status " + status + " for " + url);
    }

    public static ScreenshotException timedOut(String url) {
        return new ScreenshotException("Screenshot command timed out for " + url);
    }

    public static ScreenshotException missingFile(String url, String path) {
        return new ScreenshotException("Screenshot command produced no file at " + path + " for " + url);
    }
}
