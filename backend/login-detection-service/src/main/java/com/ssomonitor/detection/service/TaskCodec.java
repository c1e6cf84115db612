package com.ssomonitor.detection.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig;
import com.ssomonitor.detection.dto.TaskConfig;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.exception.TaskDecodingException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Reads and writes task documents. Fields the worker does not interpret, including the raw analysis
 * config, are written back exactly as received.
 */
@Component
@RequiredArgsConstructor
public class TaskCodec {

    static final String DOMAIN = "domain";
    static final String TASK_CONFIG = "task_config";

    private final ObjectMapper objectMapper;

    public static String configKey(String analysisName) {
        return analysisName + "_config";
    }

    public static String resultKey(String analysisName) {
        return analysisName + "_result";
    }

    /**
     * @throws TaskDecodingException if the payload is not a JSON object, has no domain, or has a malformed config
     */
    public TaskMessage decode(String json, String analysisName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TaskDecodingException("Task payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TaskDecodingException("Task payload is not a JSON object");
        }

        TaskMessage task = new TaskMessage();
        task.setAnalysisName(analysisName);
        String configKey = configKey(analysisName);
        String resultKey = resultKey(analysisName);

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            try {
                if (DOMAIN.equals(name)) {
                    task.setDomain(value.isNull() ? null : value.asText());
                } else if (configKey.equals(name)) {
                    task.setRawAnalysisConfig(value);
                    task.setAnalysisConfig(value.isNull()
                            ? LoginPageAnalysisConfig.defaults()
                            : objectMapper.treeToValue(value, LoginPageAnalysisConfig.class));
                } else if (TASK_CONFIG.equals(name)) {
                    task.setTaskConfig(value.isNull() ? new TaskConfig() : objectMapper.treeToValue(value, TaskConfig.class));
                } else if (resultKey.equals(name)) {
                    task.setAnalysisResult(value.isNull() ? null : objectMapper.treeToValue(value, AnalysisResult.class));
                } else {
                    task.getOtherFields().put(name, value);
                }
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new TaskDecodingException("Malformed field '" + name + "' in task payload: " + e.getMessage(), e);
            }
        }

        if (task.getDomain() == null || task.getDomain().isBlank()) {
            throw new TaskDecodingException("Task payload has no domain");
        }
        if (task.getAnalysisConfig() == null) {
            task.setAnalysisConfig(LoginPageAnalysisConfig.defaults());
        }
        if (task.getTaskConfig() == null) {
            task.setTaskConfig(new TaskConfig());
        }
        return task;
    }

    public String encode(TaskMessage task) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(DOMAIN, task.getDomain());
        task.getOtherFields().forEach(root::set);
        if (task.getRawAnalysisConfig() != null) {
            root.set(configKey(task.getAnalysisName()), task.getRawAnalysisConfig());
        }
        root.set(TASK_CONFIG, objectMapper.valueToTree(task.getTaskConfig()));
        if (task.getAnalysisResult() != null) {
            root.set(resultKey(task.getAnalysisName()), objectMapper.valueToTree(task.getAnalysisResult()));
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize task " + task.getTaskId(), e);
        }
    }
}
