package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Deduplicated candidate as submitted to the collector. Ids start at 1.
 */
public record MergedCandidate(
        @JsonProperty("id") int id,
        @JsonProperty("url") String url,
        @JsonProperty("actions") List<CrawlAction> actions,
        @JsonProperty("scan_domain") String scanDomain
) {
}
