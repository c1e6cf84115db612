package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.client.DiscoverySourceClient;
import com.ssomonitor.detection.client.DiscoverySourceClient.FetchedResource;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.RobotsStrategyConfig;
import com.ssomonitor.detection.dto.Priority;
import com.ssomonitor.detection.dto.info.RobotsInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.SourceFetchException;
import com.ssomonitor.detection.service.strategy.RobotsTxtParser.RobotsPath;
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
 * Candidates from the Allow/Disallow paths of robots.txt that match a login regex and are confirmed by the oracle.
 * Output is ordered by descending priority.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RobotsStrategy implements LoginPageStrategy {

    private final DiscoverySourceClient sourceClient;
    private final CandidateVerifier verifier;

    @Override
    public LoginPageStrategyType type() {
        return LoginPageStrategyType.ROBOTS;
    }

    @Override
    public List<Candidate> discover(StrategyContext context) {
        RobotsStrategyConfig config = context.config().loginPageConfig().robots();
        String origin = UrlHelper.origin(context.resolved().url());
        String robotsUrl = origin + "/robots.txt";
        log.info("Requesting robots.txt on: {}", robotsUrl);

        FetchedResource robots;
        try {
            robots = sourceClient.fetch(robotsUrl, Duration.ofSeconds(config.timeoutFetchRobots()));
        } catch (SourceFetchException e) {
            log.info("Error while requesting robots.txt on {}: {}", robotsUrl, e.getMessage());
            return List.of();
        }
        if (!robots.isOk() || !robots.hasContentType("text/plain")) {
            log.info("Did not find robots.txt on {} (HTTP {}, content type {})",
                    robotsUrl, robots.status(), robots.contentType());
            return List.of();
        }

        String robotsTxt = robots.bodyAsString();
        if (context.config().artifactsConfig().storeRobots()) {
            context.result().setRobots(robotsTxt);
        }

        UrlPriorityScorer scorer = context.scorer();
        Set<String> checked = new HashSet<>();
        List<Candidate> accepted = new ArrayList<>();
        for (RobotsPath robotsPath : RobotsTxtParser.paths(robotsTxt)) {
            String url = origin + robotsPath.path();
            Priority priority = scorer.score(url);
            if (!priority.isPositive() || !checked.add(url)) {
                continue;
            }
            if (verifier.verify(url, type(), context.oracle()) == CandidateVerifier.Outcome.ACCEPTED) {
                accepted.add(Candidate.builder()
                        .url(UrlHelper.normalize(url))
                        .strategy(type())
                        .priority(priority)
                        .info(new RobotsInfo(robotsPath.path(), robotsPath.stm()))
                        .build());
            }
        }

        accepted.sort(Comparator.comparingInt(Candidate::priorityScore).reversed());
        log.info("Robots strategy accepted {} of {} checked paths", accepted.size(), checked.size());
        return accepted.size() > config.maxCandidates()
                ? new ArrayList<>(accepted.subList(0, config.maxCandidates()))
                : accepted;
    }
}
