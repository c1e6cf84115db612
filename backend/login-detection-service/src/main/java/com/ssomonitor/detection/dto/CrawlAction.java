package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a crawler action log: the click performed at {@code step} and the page it produced.
 * The final entry of a flow has no click position.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawlAction(
        @JsonProperty("step") Integer step,
        @JsonProperty("clickPosition") ClickPosition clickPosition,
        @JsonProperty("elementHTML") String elementHtml,
        @JsonProperty("screenshot") String screenshot,
        @JsonProperty("url") String url
) {

    public boolean hasClick() {
        return clickPosition != null;
    }
}
