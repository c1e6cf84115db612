package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ssomonitor.detection.dto.info.StrategyInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import lombok.Builder;

import java.util.List;

/**
 * A URL that a strategy believes to be a login page.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record Candidate(
        @JsonProperty("login_page_candidate") String url,
        @JsonProperty("login_page_strategy") LoginPageStrategyType strategy,
        @JsonProperty("login_page_priority") Priority priority,
        @JsonProperty("login_page_info") StrategyInfo info,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("login_page_actions") List<CrawlAction> actions
) {

    public Candidate {
        actions = actions == null ? null : List.copyOf(actions);
    }

    public int priorityScore() {
        return priority == null ? 0 : priority.priority();
    }
}
