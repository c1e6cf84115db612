package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.util.UrlHelper;
import com.ssomonitor.detection.util.UrlPriorityScorer;

/**
 * Everything a strategy needs for one task.
 *
 * @param result in-flight result, used only to store the robots.txt/sitemap artifacts
 */
public record StrategyContext(
        String domain,
        ResolvedTarget resolved,
        LoginPageAnalysisConfig config,
        ClassificationOracle oracle,
        AnalysisResult result
) {

    public UrlPriorityScorer scorer() {
        return new UrlPriorityScorer(config.loginPageConfig().urlRegexes());
    }

    /**
     * Host that discovered URLs must share a registrable domain with.
     */
    public String resolvedHost() {
        return UrlHelper.host(resolved.url()).orElse(resolved.domain());
    }
}
