package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Landing URL of the scanned domain after redirects.
 */
public record ResolvedTarget(
        @JsonProperty("url") String url,
        @JsonProperty("domain") String domain,
        @JsonProperty("reachable") boolean reachable
) {
}
