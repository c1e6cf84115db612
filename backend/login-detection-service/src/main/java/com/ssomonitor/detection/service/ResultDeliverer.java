package com.ssomonitor.detection.service;

import com.ssomonitor.detection.client.CallbackClient;
import com.ssomonitor.detection.client.CandidateCollectorClient;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.CandidateSubmission;
import com.ssomonitor.detection.dto.DeliveryReceipt;
import com.ssomonitor.detection.dto.MergedCandidate;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.entity.TaskState;
import com.ssomonitor.detection.metrics.WorkerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Reports a finished task: candidates to the collector (best effort), then the whole task document to
 * the requester's callback (until it succeeds).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultDeliverer {

    private final CandidateCollectorClient collectorClient;
    private final CallbackClient callbackClient;
    private final TaskCodec taskCodec;
    private final WorkerMetrics metrics;

    /**
     * Blocks until the callback accepted the task. On return the task is RESPONSE_SENT.
     */
    public void deliver(List<MergedCandidate> merged, TaskMessage task) {
        DeliveryReceipt receipt = collectorClient.submit(new CandidateSubmission(merged, task.getTaskId()));
        if (!receipt.delivered()) {
            metrics.collectorFailure();
        }

        AnalysisResult result = task.getAnalysisResult();
        if (result != null && !AnalysisResult.TIMEOUT_MARKER.equals(result.getException())) {
            result.setCandidateDelivery(receipt);
        }

        task.getTaskConfig().transitionTo(TaskState.RESPONSE_SENT, Instant.now());

        String replyTo = task.getReplyTo();
        if (replyTo == null || replyTo.isBlank()) {
            log.warn("Task {} has no reply-to, skipping the callback", task.getTaskId());
            return;
        }
        callbackClient.putResult(replyTo, taskCodec.encode(task));
    }
}
