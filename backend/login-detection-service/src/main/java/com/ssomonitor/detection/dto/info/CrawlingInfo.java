package com.ssomonitor.detection.dto.info;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where in the crawler output the shortest path to the page was found.
 */
public record CrawlingInfo(
        @JsonProperty("flow") int flow,
        @JsonProperty("page") int page,
        @JsonProperty("click_count") int clickCount
) implements StrategyInfo {
}
