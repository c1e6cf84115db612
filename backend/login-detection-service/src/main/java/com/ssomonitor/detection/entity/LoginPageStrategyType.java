package com.ssomonitor.detection.entity;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Independent discovery methods that can contribute login page candidates.
 */
public enum LoginPageStrategyType {

    /**
     * Allow/Disallow paths listed in robots.txt.
     */
    ROBOTS("robots"),

    /**
     * Pages listed in the site's sitemap tree.
     */
    SITEMAP("sitemaps"),

    /**
     * Results returned by the metasearch aggregator.
     */
    METASEARCH("metasearch"),

    /**
     * Pages reached by the external click-through crawler.
     */
    CRAWLING("crawling");

    private final String screenshotDirectory;

    LoginPageStrategyType(String screenshotDirectory) {
        this.screenshotDirectory = screenshotDirectory;
    }

    /**
     * Sub-directory below the screenshot root where this strategy stores captures.
     */
    public String getScreenshotDirectory() {
        return screenshotDirectory;
    }

    @JsonCreator
    public static LoginPageStrategyType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
