package com.ssomonitor.detection.exception;

/**
 * A collector or callback request failed. A status code of 0 means the request never got a response.
 */
public class DeliveryException extends WorkerException {

    private final int statusCode;

    public DeliveryException(String message, int statusCode) {
        super("DELIVERY_ERROR", message);
        this.statusCode = statusCode;
    }

    public DeliveryException(String message, int statusCode, Throwable cause) {
        super("DELIVERY_ERROR", message, cause);
        this.statusCode = statusCode;
    }

    public static DeliveryException unexpectedStatus(String target, int statusCode, String body) {
        String detail = body == null || body.isBlank() ? "" : ": " + (body.length() > 500 ? body.substring(0, 500) : body);
        return new DeliveryException(target + " answered with HTTP " + statusCode + detail, statusCode);
    }

    public static DeliveryException transport(String target, Throwable cause) {
        return new DeliveryException(target + " could not be reached: " + cause.getMessage(), 0, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
