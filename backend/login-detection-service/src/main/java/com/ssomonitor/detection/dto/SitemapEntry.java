package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A page listed in a sitemap. {@code lastModified} is epoch seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SitemapEntry(
        @JsonProperty("url") String url,
        @JsonProperty("priority") Double priority,
        @JsonProperty("last_modified") Long lastModified,
        @JsonProperty("change_frequency") String changeFrequency,
        @JsonProperty("news_story") String newsStory
) {
}
