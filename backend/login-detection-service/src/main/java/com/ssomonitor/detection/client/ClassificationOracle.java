package com.ssomonitor.detection.client;

import com.ssomonitor.detection.exception.ClassificationException;

import java.time.Duration;

/**
 * Asks an external visual classifier whether a screenshot shows a login form.
 */
public interface ClassificationOracle {

    /**
     * @param imageReference local screenshot path or image URL
     * @return a definite verdict
     * @throws ClassificationException on any connection or protocol failure
     */
    ClassificationVerdict classify(String imageReference);

    /**
     * Same oracle with a different request timeout. Transports without a per-request timeout return themselves.
     */
    default ClassificationOracle withTimeout(Duration timeout) {
        return this;
    }
}
