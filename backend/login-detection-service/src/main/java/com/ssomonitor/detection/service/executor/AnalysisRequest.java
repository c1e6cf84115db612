package com.ssomonitor.detection.service.executor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig;

/**
 * What the isolated analysis process needs to know about its task.
 */
public record AnalysisRequest(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("analysis") String analysisName,
        @JsonProperty("domain") String domain,
        @JsonProperty("config") LoginPageAnalysisConfig config
) {
}
