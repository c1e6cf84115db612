package com.ssomonitor.detection.metrics;

import com.ssomonitor.detection.entity.LoginPageStrategyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for task throughput, analysis outcome and delivery health.
 */
@Component
public class WorkerMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter tasksReceived;
    private final Counter tasksCompleted;
    private final Counter tasksTimedOut;
    private final Counter tasksFailed;
    private final Counter collectorFailures;
    private final Counter callbackRetries;
    private final Timer analysisDuration;

    public WorkerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.tasksReceived = Counter.builder("worker.tasks.received")
                .description("Task records accepted from the queue")
                .register(meterRegistry);
        this.tasksCompleted = Counter.builder("worker.tasks.completed")
                .description("Tasks acknowledged after delivery")
                .register(meterRegistry);
        this.tasksTimedOut = Counter.builder("worker.tasks.timed_out")
                .description("Analyses killed at the deadline")
                .register(meterRegistry);
        this.tasksFailed = Counter.builder("worker.tasks.failed")
                .description("Analyses that ended with an exception")
                .register(meterRegistry);
        this.collectorFailures = Counter.builder("worker.delivery.collector.failures")
                .description("Candidate submissions given up after the retry")
                .register(meterRegistry);
        this.callbackRetries = Counter.builder("worker.delivery.callback.retries")
                .description("Callback PUT attempts that will be retried")
                .register(meterRegistry);
        this.analysisDuration = Timer.builder("worker.analysis.duration")
                .description("Wall clock time of isolated analyses")
                .register(meterRegistry);
    }

    public void taskReceived() {
        tasksReceived.increment();
    }

    public void taskCompleted() {
        tasksCompleted.increment();
    }

    public void taskTimedOut() {
        tasksTimedOut.increment();
    }

    public void taskFailed() {
        tasksFailed.increment();
    }

    public void collectorFailure() {
        collectorFailures.increment();
    }

    public void callbackRetry() {
        callbackRetries.increment();
    }

    public void analysisFinished(Duration elapsed) {
        analysisDuration.record(elapsed);
    }

    public void candidatesAccepted(LoginPageStrategyType strategy, int count) {
        meterRegistry.counter("worker.candidates.accepted", "strategy", strategy.name()).increment(count);
    }
}
