package com.ssomonitor.detection.client;

/**
 * Binary answer of the classification oracle for one screenshot, with the text it was derived from.
 */
public record ClassificationVerdict(Outcome outcome, String rawText) {

    public enum Outcome {
        LOGIN_PRESENT,
        NOT_PRESENT
    }

    public static ClassificationVerdict loginPresent(String rawText) {
        return new ClassificationVerdict(Outcome.LOGIN_PRESENT, rawText);
    }

    public static ClassificationVerdict notPresent(String rawText) {
        return new ClassificationVerdict(Outcome.NOT_PRESENT, rawText);
    }

    public boolean isLoginPresent() {
        return outcome == Outcome.LOGIN_PRESENT;
    }
}
