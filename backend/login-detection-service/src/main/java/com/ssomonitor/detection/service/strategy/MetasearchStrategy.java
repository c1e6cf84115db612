package com.ssomonitor.detection.service.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.client.SearxngClient;
import com.ssomonitor.detection.client.SearxngClient.SearchPage;
import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.MetasearchStrategyConfig;
import com.ssomonitor.detection.dto.info.MetasearchInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.SourceFetchException;
import com.ssomonitor.detection.util.UrlHelper;
import com.ssomonitor.detection.util.UrlPriorityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Candidates from a metasearch query for the target's registrable domain. Every same-domain result is
 * classified whatever its priority, and the aggregator's ordering is kept.
 */
@Component
@Slf4j
public class MetasearchStrategy implements LoginPageStrategy {

    private final SearxngClient searxngClient;
    private final CandidateVerifier verifier;
    private final Duration oracleTimeout;

    @Autowired
    public MetasearchStrategy(SearxngClient searxngClient, CandidateVerifier verifier, WorkerProperties properties) {
        this(searxngClient, verifier, properties.getOracle().getMetasearchTimeout());
    }

    public MetasearchStrategy(SearxngClient searxngClient, CandidateVerifier verifier, Duration oracleTimeout) {
        this.searxngClient = searxngClient;
        this.verifier = verifier;
        this.oracleTimeout = oracleTimeout;
    }

    @Override
    public LoginPageStrategyType type() {
        return LoginPageStrategyType.METASEARCH;
    }

    @Override
    public List<Candidate> discover(StrategyContext context) {
        MetasearchStrategyConfig config = context.config().loginPageConfig().metasearch();
        String resolvedHost = context.resolvedHost();
        String registrableDomain = UrlHelper.registrableDomain(resolvedHost);
        String query = config.searchTerm().replace("%s", registrableDomain);
        String engines = engineParameter(config.searchEngines());
        int wanted = config.searchResultsNumber();
        ClassificationOracle oracle = context.oracle().withTimeout(oracleTimeout);
        UrlPriorityScorer scorer = context.scorer();

        log.info("Starting searxng login page detection for: {}", registrableDomain);

        Set<String> seen = new HashSet<>();
        List<Candidate> accepted = new ArrayList<>();
        int hitCounter = 0;
        int pageNo = 1;
        while (accepted.size() < wanted) {
            SearchPage page;
            try {
                page = searxngClient.search(query, engines, pageNo);
            } catch (SourceFetchException e) {
                log.info("Error while requesting searxng results, stopping search: {}", e.getMessage());
                break;
            }
            log.info("Received #{} results from searxng on page #{}", page.results().size(), pageNo);
            if (!page.unresponsiveEngines().isEmpty()) {
                log.info("Following search engines are unresponsive: {}", page.unresponsiveEngines());
            }
            if (page.results().isEmpty()) {
                log.info("Searxng did not find any results on page #{}, stopping search", pageNo);
                break;
            }

            int newUrls = 0;
            for (JsonNode result : page.results()) {
                hitCounter++;
                String url = result.path("url").asText(null);
                if (url == null || !UrlHelper.isSameRegistrableDomain(url, resolvedHost)) {
                    log.debug("Search result {} is on a different registrable domain", url);
                    continue;
                }
                if (!seen.add(url)) {
                    log.debug("Search result {} is a duplicate", url);
                    continue;
                }
                newUrls++;
                if (accepted.size() >= wanted) {
                    continue;
                }
                if (verifier.verify(url, type(), oracle) == CandidateVerifier.Outcome.ACCEPTED) {
                    accepted.add(Candidate.builder()
                            .url(UrlHelper.normalize(url))
                            .strategy(type())
                            .priority(scorer.score(url))
                            .info(new MetasearchInfo(hitCounter, upperCasedEngines(result), result))
                            .build());
                }
            }

            if (accepted.size() >= wanted) {
                log.info("Searxng found {} of min. {} results, stopping search", accepted.size(), wanted);
                break;
            }
            if (newUrls == 0) {
                log.info("Searxng did not find any new results on page #{}, stopping search", pageNo);
                break;
            }
            pageNo++;
        }

        return accepted.size() > wanted ? new ArrayList<>(accepted.subList(0, wanted)) : accepted;
    }

    /**
     * Engines are trimmed, lower-cased and sent in reverse of the configured order.
     */
    static String engineParameter(List<String> engines) {
        List<String> normalized = new ArrayList<>();
        for (String engine : engines) {
            normalized.add(0, engine.trim().toLowerCase(Locale.ROOT));
        }
        return String.join(",", normalized);
    }

    private static List<String> upperCasedEngines(JsonNode result) {
        List<String> engines = new ArrayList<>();
        result.path("engines").forEach(engine -> engines.add(engine.asText().toUpperCase(Locale.ROOT)));
        return engines;
    }
}
