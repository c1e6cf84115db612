package com.ssomonitor.detection.service.executor;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.entity.TaskState;
import com.ssomonitor.detection.exception.AnalysisLaunchException;
import com.ssomonitor.detection.metrics.WorkerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs one task's analysis under a hard deadline.
 *
 * <p>An analysis that misses the deadline is killed and its result replaced by the timeout marker, so a
 * partial candidate list is never reported. Analysis failures come back as results; only a failure to
 * launch the isolated process is thrown.
 */
@Service
@Slf4j
public class TaskExecutor {

    private final AnalysisLauncher launcher;
    private final WorkerMetrics metrics;
    private final Duration deadline;

    @Autowired
    public TaskExecutor(AnalysisLauncher launcher, WorkerMetrics metrics, WorkerProperties properties) {
        this(launcher, metrics, properties.getExecutor().getDeadline());
    }

    public TaskExecutor(AnalysisLauncher launcher, WorkerMetrics metrics, Duration deadline) {
        this.launcher = launcher;
        this.metrics = metrics;
        this.deadline = deadline;
    }

    /**
     * Moves the task RECEIVED -> RUNNING -> COMPLETED|TIMED_OUT and stores the result on it.
     *
     * @throws AnalysisLaunchException if the analysis could not be started; the task is left RUNNING
     */
    public AnalysisResult execute(TaskMessage task) {
        Instant started = Instant.now();
        task.getTaskConfig().transitionTo(TaskState.RUNNING, started);

        RunningAnalysis analysis = launcher.launch(task);
        AnalysisResult result;
        TaskState finalState = TaskState.COMPLETED;
        try {
            if (analysis.awaitCompletion(deadline)) {
                result = analysis.result();
            } else {
                log.error("Analysis of {} exceeded the deadline of {}, killing it", task.getDomain(), deadline);
                analysis.kill();
                result = AnalysisResult.timeout();
                finalState = TaskState.TIMED_OUT;
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for the analysis of {}, killing it", task.getDomain());
            analysis.kill();
            Thread.currentThread().interrupt();
            result = AnalysisResult.failure("Analysis interrupted");
        }

        Instant finished = Instant.now();
        metrics.analysisFinished(Duration.between(started, finished));
        recordOutcome(task, result, finalState);

        task.setAnalysisResult(result);
        task.getTaskConfig().transitionTo(finalState, finished);
        return result;
    }

    private void recordOutcome(TaskMessage task, AnalysisResult result, TaskState finalState) {
        if (finalState == TaskState.TIMED_OUT) {
            metrics.taskTimedOut();
            return;
        }
        if (result.isFailure()) {
            log.error("Analysis of {} failed: {}", task.getDomain(), result.getException());
            metrics.taskFailed();
            return;
        }

        Map<LoginPageStrategyType, Integer> perStrategy = new EnumMap<>(LoginPageStrategyType.class);
        for (Candidate candidate : result.candidatesOrEmpty()) {
            if (candidate.strategy() != null) {
                perStrategy.merge(candidate.strategy(), 1, Integer::sum);
            }
        }
        perStrategy.forEach(metrics::candidatesAccepted);
        log.info("Analysis of {} completed with {} candidates {}", task.getDomain(),
                result.candidatesOrEmpty().size(), perStrategy);
    }
}
