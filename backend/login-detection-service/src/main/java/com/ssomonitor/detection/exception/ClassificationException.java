package com.ssomonitor.detection.exception;

/**
 * The classification oracle could not produce a verdict.
 * Callers must treat this as "unknown", never as a negative verdict.
 */
public class ClassificationException extends WorkerException {

    public ClassificationException(String message) {
        super("CLASSIFICATION_ERROR", message);
    }

    public ClassificationException(String message, Throwable cause) {
        super("CLASSIFICATION_ERROR", message, cause);
    }

    public static ClassificationException connectionFailed(String endpoint, Throwable cause) {
        return new ClassificationException("Could not reach classification oracle at " + endpoint
                + ": " + cause.getMessage(), cause);
    }

    public static ClassificationException emptyReply(String endpoint) {
        return new ClassificationException("Classification oracle at " + endpoint + " closed without a reply");
    }

    public static ClassificationException oracleError(String reply) {
        return new ClassificationException("Classification oracle reported: " + reply);
    }

    public static ClassificationException noVerdict(String text) {
        return new ClassificationException("No YES/NO verdict in oracle response: " + abbreviate(text));
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "<empty>";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
