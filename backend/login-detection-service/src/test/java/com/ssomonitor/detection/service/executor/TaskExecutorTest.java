package com.ssomonitor.detection.service.executor;

import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.dto.TaskConfig;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.entity.TaskState;
import com.ssomonitor.detection.exception.AnalysisLaunchException;
import com.ssomonitor.detection.metrics.WorkerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskExecutorTest {

    private static final Duration DEADLINE = Duration.ofSeconds(60);

    @Mock
    private AnalysisLauncher launcher;

    @Mock
    private RunningAnalysis analysis;

    private SimpleMeterRegistry registry;
    private TaskExecutor executor;
    private TaskMessage task;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        executor = new TaskExecutor(launcher, new WorkerMetrics(registry), DEADLINE);

        TaskConfig config = new TaskConfig();
        config.setTaskId("t-1");
        config.transitionTo(TaskState.RECEIVED, Instant.now());
        task = new TaskMessage();
        task.setAnalysisName("login_page_analysis");
        task.setDomain("example.com");
        task.setTaskConfig(config);
    }

    @Test
    @DisplayName("기한 내 완료되면 결과를 저장하고 COMPLETED")
    void completesWithinDeadline() throws Exception {
        // given
        AnalysisResult result = AnalysisResult.forTarget(new ResolvedTarget("https://example.com/", "example.com", true));
        result.addCandidates(List.of(
                candidate("https://example.com/login", LoginPageStrategyType.ROBOTS),
                candidate("https://example.com/signin", LoginPageStrategyType.ROBOTS),
                candidate("https://example.com/account", LoginPageStrategyType.CRAWLING)));
        when(launcher.launch(task)).thenReturn(analysis);
        when(analysis.awaitCompletion(DEADLINE)).thenReturn(true);
        when(analysis.result()).thenReturn(result);

        // when
        AnalysisResult returned = executor.execute(task);

        // then
        assertThat(returned).isSameAs(result);
        assertThat(task.getAnalysisResult()).isSameAs(result);
        assertThat(task.getTaskConfig().getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(task.getTaskConfig().getTimestamp(TaskState.RUNNING)).isNotNull();
        verify(analysis, never()).kill();
        assertThat(registry.get("worker.candidates.accepted").tag("strategy", "ROBOTS").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("worker.candidates.accepted").tag("strategy", "CRAWLING").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("worker.analysis.duration").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("기한을 넘기면 프로세스를 죽이고 시간 초과 표식만 남긴다")
    void killsOnDeadline() throws Exception {
        // given
        when(launcher.launch(task)).thenReturn(analysis);
        when(analysis.awaitCompletion(DEADLINE)).thenReturn(false);

        // when
        AnalysisResult result = executor.execute(task);

        // then
        verify(analysis).kill();
        verify(analysis, never()).result();
        assertThat(result.getException()).isEqualTo(AnalysisResult.TIMEOUT_MARKER);
        assertThat(result.getLoginPageCandidates()).isNull();
        assertThat(result.getResolved()).isNull();
        assertThat(task.getTaskConfig().getState()).isEqualTo(TaskState.TIMED_OUT);
        assertThat(registry.get("worker.tasks.timed_out").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("분석 실패는 결과로 기록되고 COMPLETED")
    void failureResultIsCompleted() throws Exception {
        // given
        when(launcher.launch(task)).thenReturn(analysis);
        when(analysis.awaitCompletion(DEADLINE)).thenReturn(true);
        when(analysis.result()).thenReturn(AnalysisResult.failure("Unable to resolve example.com"));

        // when
        AnalysisResult result = executor.execute(task);

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(task.getTaskConfig().getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(registry.get("worker.tasks.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("대기 중 인터럽트되면 프로세스를 죽이고 실패 결과")
    void interruptedWhileWaiting() throws Exception {
        // given
        when(launcher.launch(task)).thenReturn(analysis);
        when(analysis.awaitCompletion(DEADLINE)).thenThrow(new InterruptedException());

        // when
        AnalysisResult result = executor.execute(task);

        // then
        assertThat(Thread.interrupted()).isTrue();
        verify(analysis).kill();
        assertThat(result.getException()).isEqualTo("Analysis interrupted");
        assertThat(task.getTaskConfig().getState()).isEqualTo(TaskState.COMPLETED);
    }

    @Test
    @DisplayName("프로세스를 띄우지 못하면 예외를 그대로 던진다")
    void launchFailurePropagates() {
        // given
        when(launcher.launch(any())).thenThrow(AnalysisLaunchException.of("t-1", new IOException("no java")));

        // when / then
        assertThatThrownBy(() -> executor.execute(task))
                .isInstanceOf(AnalysisLaunchException.class)
                .hasMessageContaining("no java");
        assertThat(task.getTaskConfig().getState()).isEqualTo(TaskState.RUNNING);
    }

    private static Candidate candidate(String url, LoginPageStrategyType strategy) {
        return Candidate.builder().url(url).strategy(strategy).build();
    }
}
