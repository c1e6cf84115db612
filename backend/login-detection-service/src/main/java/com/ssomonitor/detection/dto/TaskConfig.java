package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ssomonitor.detection.entity.TaskState;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Mutable audit trail of a task. Fields the worker does not know about are kept and written back.
 */
@Getter
@Setter
public class TaskConfig {

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("reply_to")
    private String replyTo;

    @JsonProperty("task_state")
    private String taskState;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    @JsonAnySetter
    public void setProperty(String name, Object value) {
        properties.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Current state, or null if the incoming document carried a state this worker does not define.
     */
    @JsonIgnore
    public TaskState getState() {
        if (taskState == null) {
            return null;
        }
        try {
            return TaskState.valueOf(taskState.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Moves to {@code next} and records the transition time in epoch seconds.
     * RECEIVED is accepted from any incoming state, every other step must follow the lifecycle.
     */
    public void transitionTo(TaskState next, Instant now) {
        TaskState current = getState();
        if (next != TaskState.RECEIVED && (current == null || !current.canTransitionTo(next))) {
            throw new IllegalStateException("Invalid task state transition " + taskState + " -> " + next
                    + " for task " + taskId);
        }
        this.taskState = next.name();
        properties.put(next.getTimestampField(), now.getEpochSecond());
    }

    @JsonIgnore
    public Long getTimestamp(TaskState state) {
        Object value = properties.get(state.getTimestampField());
        return value instanceof Number ? ((Number) value).longValue() : null;
    }
}
