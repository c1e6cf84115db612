package com.ssomonitor.detection.dto.info;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ssomonitor.detection.dto.SitemapEntry;

public record SitemapInfo(
        @JsonProperty("priority") Double priority,
        @JsonProperty("last_modified") Long lastModified,
        @JsonProperty("change_frequency") String changeFrequency,
        @JsonProperty("news_story") String newsStory
) implements StrategyInfo {

    public static SitemapInfo from(SitemapEntry entry) {
        return new SitemapInfo(entry.priority(), entry.lastModified(), entry.changeFrequency(), entry.newsStory());
    }
}
