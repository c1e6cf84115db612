package com.ssomonitor.detection.dto.info;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * @param resultHit     1-based rank of the result across all fetched pages
 * @param resultEngines engines that returned the result, upper-cased
 * @param resultRaw     the unmodified result object from the aggregator
 */
public record MetasearchInfo(
        @JsonProperty("result_hit") int resultHit,
        @JsonProperty("result_engines") List<String> resultEngines,
        @JsonProperty("result_raw") JsonNode resultRaw
) implements StrategyInfo {
}
