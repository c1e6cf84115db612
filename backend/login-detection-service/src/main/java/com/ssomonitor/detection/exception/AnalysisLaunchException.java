package com.ssomonitor.detection.exception;

/**
 * The isolated analysis context could not be created.
 */
public class AnalysisLaunchException extends WorkerException {

    public AnalysisLaunchException(String message, String taskId, Throwable cause) {
        super("ANALYSIS_LAUNCH_ERROR", message, taskId, cause);
    }

    public static AnalysisLaunchException of(String taskId, Throwable cause) {
        return new AnalysisLaunchException("Could not launch analysis process: " + cause.getMessage(), taskId, cause);
    }
}
