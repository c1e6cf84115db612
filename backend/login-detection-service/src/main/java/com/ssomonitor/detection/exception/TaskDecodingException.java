package com.ssomonitor.detection.exception;

/**
 * A queue payload is not a valid task document.
 */
public class TaskDecodingException extends WorkerException {

    public TaskDecodingException(String message, Throwable cause) {
        super("TASK_DECODING_ERROR", message, cause);
    }

    public TaskDecodingException(String message) {
        super("TASK_DECODING_ERROR", message);
    }
}
