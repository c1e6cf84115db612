package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One task document as received from the queue. The analysis specific keys are
 * {@code <analysisName>_config} and {@code <analysisName>_result}; every other top-level field is kept
 * so that the callback receives the complete document.
 */
@Getter
@Setter
public class TaskMessage {

    private String analysisName;
    private String domain;
    private JsonNode rawAnalysisConfig;
    private LoginPageAnalysisConfig analysisConfig;
    private TaskConfig taskConfig;
    private AnalysisResult analysisResult;
    private final Map<String, JsonNode> otherFields = new LinkedHashMap<>();

    public String getTaskId() {
        return taskConfig == null ? null : taskConfig.getTaskId();
    }

    public String getReplyTo() {
        return taskConfig == null ? null : taskConfig.getReplyTo();
    }

    /**
     * Domain reported with every merged candidate: {@code scan_config.domain} when present, else {@code domain}.
     */
    public String getScanDomain() {
        JsonNode scanConfig = otherFields.get("scan_config");
        if (scanConfig != null && scanConfig.hasNonNull("domain")) {
            String override = scanConfig.get("domain").asText();
            if (!override.isBlank()) {
                return override;
            }
        }
        return domain;
    }
}
