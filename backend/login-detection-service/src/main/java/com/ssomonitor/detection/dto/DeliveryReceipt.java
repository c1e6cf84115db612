package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the collector submission, attached to the task result before the callback.
 * {@code statusCode} is 0 when no HTTP response was received.
 */
public record DeliveryReceipt(
        @JsonProperty("delivered") boolean delivered,
        @JsonProperty("status_code") int statusCode,
        @JsonProperty("error_detail") String errorDetail,
        @JsonProperty("attempts") int attempts
) {

    public static DeliveryReceipt success(int statusCode, int attempts) {
        return new DeliveryReceipt(true, statusCode, null, attempts);
    }

    public static DeliveryReceipt failure(int statusCode, String errorDetail, int attempts) {
        return new DeliveryReceipt(false, statusCode, errorDetail, attempts);
    }
}
