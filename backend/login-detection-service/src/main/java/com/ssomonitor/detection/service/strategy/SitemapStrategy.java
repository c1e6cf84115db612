package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.SitemapStrategyConfig;
import com.ssomonitor.detection.dto.Priority;
import com.ssomonitor.detection.dto.SitemapEntry;
import com.ssomonitor.detection.dto.info.SitemapInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.util.UrlHelper;
import com.ssomonitor.detection.util.UrlPriorityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidates from sitemap pages on the target's registrable domain that match a login regex and are
 * confirmed by the oracle. Output is ordered by descending priority.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SitemapStrategy implements LoginPageStrategy {

    private final SitemapTreeFetcher treeFetcher;
    private final CandidateVerifier verifier;

    @Override
    public LoginPageStrategyType type() {
        return LoginPageStrategyType.SITEMAP;
    }

    @Override
    public List<Candidate> discover(StrategyContext context) {
        SitemapStrategyConfig config = context.config().loginPageConfig().sitemap();
        log.info("Starting sitemap login page detection for: {}", context.resolved().url());

        List<SitemapEntry> pages = treeFetcher.fetchTree(context.resolved().url(), config.maxRecursionLevel(),
                config.maxSitemapSize(), Duration.ofSeconds(config.timeoutFetchSitemap()));
        if (context.config().artifactsConfig().storeSitemap() && !pages.isEmpty()) {
            context.result().setSitemap(pages);
        }

        UrlPriorityScorer scorer = context.scorer();
        String resolvedHost = context.resolvedHost();
        Set<String> checked = new HashSet<>();
        List<Candidate> accepted = new ArrayList<>();
        for (SitemapEntry page : pages) {
            Priority priority = scorer.score(page.url());
            if (!priority.isPositive()) {
                continue;
            }
            if (!UrlHelper.isSameRegistrableDomain(page.url(), resolvedHost)) {
                log.debug("Sitemap url {} is on a different registrable domain", page.url());
                continue;
            }
            if (!checked.add(page.url())) {
                continue;
            }
            if (verifier.verify(page.url(), type(), context.oracle()) == CandidateVerifier.Outcome.ACCEPTED) {
                accepted.add(Candidate.builder()
                        .url(UrlHelper.normalize(page.url()))
                        .strategy(type())
                        .priority(priority)
                        .info(SitemapInfo.from(page))
                        .build());
            }
        }

        accepted.sort(Comparator.comparingInt(Candidate::priorityScore).reversed());
        log.info("Sitemap strategy accepted {} of {} checked pages", accepted.size(), checked.size());
        return accepted.size() > config.maxCandidates()
                ? new ArrayList<>(accepted.subList(0, config.maxCandidates()))
                : accepted;
    }
}
