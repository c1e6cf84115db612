package com.ssomonitor.detection.dto;

/**
 * Score a URL received from the configured regex rules, with the rule that produced it.
 * A score of 0 means no rule matched and the URL is rejected by gated strategies.
 */
public record Priority(int priority, String regex) {

    public static final Priority NONE = new Priority(0, null);

    public boolean isPositive() {
        return priority > 0;
    }
}
