package com.ssomonitor.detection.entity;

/**
 * Lifecycle of one queued task inside the worker.
 * RECEIVED -> RUNNING -> (COMPLETED | TIMED_OUT) -> RESPONSE_SENT
 */
public enum TaskState {

    /**
     * Delivered by the broker and accepted by the consumer.
     */
    RECEIVED("task_timestamp_request_received"),

    /**
     * Analysis is executing in its isolated process.
     */
    RUNNING("task_timestamp_analysis_started"),

    /**
     * Analysis finished, successfully or with a recorded exception.
     */
    COMPLETED("task_timestamp_analysis_finished"),

    /**
     * Analysis exceeded the deadline and was killed.
     */
    TIMED_OUT("task_timestamp_analysis_finished"),

    /**
     * Result handed to the callback; the queue message may now be acknowledged.
     */
    RESPONSE_SENT("task_timestamp_response_sent");

    private final String timestampField;

    TaskState(String timestampField) {
        this.timestampField = timestampField;
    }

    public String getTimestampField() {
        return timestampField;
    }

    public boolean isTerminal() {
        return this == RESPONSE_SENT;
    }

    public boolean canTransitionTo(TaskState next) {
        switch (this) {
            case RECEIVED:
                return next == RUNNING;
            case RUNNING:
                return next == COMPLETED || next == TIMED_OUT;
            case COMPLETED:
            case TIMED_OUT:
                return next == RESPONSE_SENT;
            default:
                return false;
        }
    }
}
