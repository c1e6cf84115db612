package com.ssomonitor.detection.dto.info;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Strategy specific provenance of a candidate, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RobotsInfo.class, name = "ROBOTS"),
        @JsonSubTypes.Type(value = SitemapInfo.class, name = "SITEMAP"),
        @JsonSubTypes.Type(value = MetasearchInfo.class, name = "METASEARCH"),
        @JsonSubTypes.Type(value = CrawlingInfo.class, name = "CRAWLING")
})
public interface StrategyInfo {
}
