package com.ssomonitor.detection.dto.info;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param path the decoded robots.txt path
 * @param stm  the directive it came from, {@code allow} or {@code disallow}
 */
public record RobotsInfo(
        @JsonProperty("path") String path,
        @JsonProperty("stm") String stm
) implements StrategyInfo {
}
