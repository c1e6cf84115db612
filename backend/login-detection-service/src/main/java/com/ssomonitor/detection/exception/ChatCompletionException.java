package com.ssomonitor.detection.exception;

/**
 * A chat completion request failed or returned no message content.
 */
public class ChatCompletionException extends WorkerException {

    public ChatCompletionException(String message) {
        super("CHAT_COMPLETION_ERROR", message);
    }

    public ChatCompletionException(String message, Throwable cause) {
        super("CHAT_COMPLETION_ERROR", message, cause);
    }
}
