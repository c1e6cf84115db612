package com.ssomonitor.detection.service;

import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.MergedCandidate;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses the raw candidates of all strategies into one record per URL.
 * A CRAWLING candidate wins its URL, otherwise the first one seen does. Ids follow first-seen URL order.
 * Actions are passed through as they are, so non-crawling candidates submit {@code null}.
 */
@Component
public class CandidateReconciler {

    public List<MergedCandidate> merge(List<Candidate> candidates, String scanDomain) {
        Map<String, Candidate> byUrl = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            if (candidate == null || candidate.url() == null || candidate.url().isBlank()) {
                continue;
            }
            String url = candidate.url().trim();
            Candidate kept = byUrl.get(url);
            if (kept == null || (!isCrawling(kept) && isCrawling(candidate))) {
                byUrl.put(url, candidate);
            }
        }

        List<MergedCandidate> merged = new ArrayList<>(byUrl.size());
        int id = 1;
        for (Map.Entry<String, Candidate> entry : byUrl.entrySet()) {
            merged.add(new MergedCandidate(id++, entry.getKey(), entry.getValue().actions(), scanDomain));
        }
        return merged;
    }

    private static boolean isCrawling(Candidate candidate) {
        return candidate.strategy() == LoginPageStrategyType.CRAWLING;
    }
}
