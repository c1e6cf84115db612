package com.ssomonitor.detection.service.executor;

import com.ssomonitor.detection.dto.AnalysisResult;

import java.time.Duration;

/**
 * Handle on an analysis started by an {@link AnalysisLauncher}.
 */
public interface RunningAnalysis {

    /**
     * @return true if the analysis finished within {@code timeout}
     */
    boolean awaitCompletion(Duration timeout) throws InterruptedException;

    /**
     * Terminates the analysis forcibly, including anything it started. Safe to call more than once.
     */
    void kill();

    /**
     * Outcome of a finished analysis. Failures are reported as a result carrying {@code exception}, never thrown.
     */
    AnalysisResult result();
}
