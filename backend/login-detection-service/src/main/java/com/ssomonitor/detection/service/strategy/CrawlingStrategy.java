package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.CrawlerProcessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Candidates reached by the external crawler. The triage service already classified the screenshots
 * while the crawler ran, so no oracle call is made here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrawlingStrategy implements LoginPageStrategy {

    private final ExternalCrawler crawler;
    private final CrawlFlowAnalyzer flowAnalyzer;

    @Override
    public LoginPageStrategyType type() {
        return LoginPageStrategyType.CRAWLING;
    }

    @Override
    public List<Candidate> discover(StrategyContext context) {
        String url = context.resolved().url();
        ExternalCrawler.CrawlRun run = crawler.run(url);
        if (!run.isSuccess()) {
            throw CrawlerProcessException.nonZeroExit(url, run.exitStatus());
        }
        return flowAnalyzer.analyze(run.classifiedDirectory(), run.rawDirectory());
    }
}
