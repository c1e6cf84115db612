package com.ssomonitor.detection.exception;

/**
 * Base class for failures raised while a task is being analysed or delivered.
 */
public class WorkerException extends RuntimeException {

    private final String errorCode;
    private final String taskId;

    public WorkerException(String message) {
        super(message);
        this.errorCode = "WORKER_ERROR";
        this.taskId = null;
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "WORKER_ERROR";
        this.taskId = null;
    }

    public WorkerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.taskId = null;
    }

    public WorkerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.taskId = null;
    }

    public WorkerException(String errorCode, String message, String taskId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.taskId = taskId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getTaskId() {
        return taskId;
    }
}
