package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /api/login_candidates}.
 */
public record CandidateSubmission(
        @JsonProperty("candidates") List<MergedCandidate> candidates,
        @JsonProperty("task_id") String taskId
) {
}
