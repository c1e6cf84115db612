package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ssomonitor.detection.entity.LoginPageStrategyType;

import java.util.List;

/**
 * Typed view of {@code <analysis>_config}. Missing sections fall back to the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginPageAnalysisConfig(
        @JsonProperty("login_page_config") LoginPageConfig loginPageConfig,
        @JsonProperty("artifacts_config") ArtifactsConfig artifactsConfig
) {

    public LoginPageAnalysisConfig {
        loginPageConfig = loginPageConfig == null ? new LoginPageConfig(null, null, null, null, null) : loginPageConfig;
        artifactsConfig = artifactsConfig == null ? new ArtifactsConfig(false, false) : artifactsConfig;
    }

    public static LoginPageAnalysisConfig defaults() {
        return new LoginPageAnalysisConfig(null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LoginPageConfig(
            @JsonProperty("login_page_strategy_scope") List<LoginPageStrategyType> strategyScope,
            @JsonProperty("login_page_url_regexes") List<UrlRegexRule> urlRegexes,
            @JsonProperty("robots_strategy_config") RobotsStrategyConfig robots,
            @JsonProperty("sitemap_strategy_config") SitemapStrategyConfig sitemap,
            @JsonProperty("metasearch_strategy_config") MetasearchStrategyConfig metasearch
    ) {

        public LoginPageConfig {
            strategyScope = strategyScope == null || strategyScope.isEmpty()
                    ? List.of(LoginPageStrategyType.values())
                    : List.copyOf(strategyScope);
            urlRegexes = urlRegexes == null ? List.of() : List.copyOf(urlRegexes);
            robots = robots == null ? new RobotsStrategyConfig(null, null) : robots;
            sitemap = sitemap == null ? new SitemapStrategyConfig(null, null, null, null) : sitemap;
            metasearch = metasearch == null ? new MetasearchStrategyConfig(null, null, null) : metasearch;
        }
    }

    public record UrlRegexRule(
            @JsonProperty("regex") String regex,
            @JsonProperty("priority") int priority
    ) {
    }

    /**
     * @param timeoutFetchRobots seconds
     */
    public record RobotsStrategyConfig(
            @JsonProperty("max_candidates") Integer maxCandidates,
            @JsonProperty("timeout_fetch_robots") Integer timeoutFetchRobots
    ) {

        public RobotsStrategyConfig {
            maxCandidates = maxCandidates == null ? 10 : maxCandidates;
            timeoutFetchRobots = timeoutFetchRobots == null ? 10 : timeoutFetchRobots;
        }
    }

    /**
     * @param maxSitemapSize      bytes; larger sitemaps are skipped
     * @param timeoutFetchSitemap seconds per sitemap request
     */
    public record SitemapStrategyConfig(
            @JsonProperty("max_candidates") Integer maxCandidates,
            @JsonProperty("max_recursion_level") Integer maxRecursionLevel,
            @JsonProperty("max_sitemap_size") Long maxSitemapSize,
            @JsonProperty("timeout_fetch_sitemap") Integer timeoutFetchSitemap
    ) {

        public SitemapStrategyConfig {
            maxCandidates = maxCandidates == null ? 10 : maxCandidates;
            maxRecursionLevel = maxRecursionLevel == null ? 3 : maxRecursionLevel;
            maxSitemapSize = maxSitemapSize == null ? 50L * 1024 * 1024 : maxSitemapSize;
            timeoutFetchSitemap = timeoutFetchSitemap == null ? 30 : timeoutFetchSitemap;
        }
    }

    /**
     * @param searchTerm query template, {@code %s} is replaced by the registrable domain
     */
    public record MetasearchStrategyConfig(
            @JsonProperty("search_engines") List<String> searchEngines,
            @JsonProperty("search_term") String searchTerm,
            @JsonProperty("search_results_number") Integer searchResultsNumber
    ) {

        public MetasearchStrategyConfig {
            searchEngines = searchEngines == null ? List.of() : List.copyOf(searchEngines);
            searchTerm = searchTerm == null ? "site:%s login" : searchTerm;
            searchResultsNumber = searchResultsNumber == null ? 10 : searchResultsNumber;
        }
    }

    public record ArtifactsConfig(
            @JsonProperty("store_robots") boolean storeRobots,
            @JsonProperty("store_sitemap") boolean storeSitemap
    ) {
    }
}
