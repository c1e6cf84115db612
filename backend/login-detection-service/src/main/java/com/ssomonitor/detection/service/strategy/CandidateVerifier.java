package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.client.ClassificationVerdict;
import com.ssomonitor.detection.client.ScreenshotCapturer;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.WorkerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Screenshots a URL and asks the oracle about it. A failed screenshot or oracle call skips the URL;
 * it is never counted as a negative verdict.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateVerifier {

    public enum Outcome {
        ACCEPTED,
        REJECTED,
        SKIPPED
    }

    private final ScreenshotCapturer screenshotCapturer;

    public Outcome verify(String url, LoginPageStrategyType strategy, ClassificationOracle oracle) {
        long start = System.nanoTime();
        try {
            Path screenshot = screenshotCapturer.capture(url, strategy);
            ClassificationVerdict verdict = oracle.classify(screenshot.toString());
            log.info("{} candidate {} classified as {} in {} ms", strategy, url, verdict.outcome(),
                    (System.nanoTime() - start) / 1_000_000);
            return verdict.isLoginPresent() ? Outcome.ACCEPTED : Outcome.REJECTED;
        } catch (WorkerException e) {
            log.warn("Skipping {} candidate {} [{}]: {}", strategy, url, e.getErrorCode(), e.getMessage());
            return Outcome.SKIPPED;
        }
    }
}
