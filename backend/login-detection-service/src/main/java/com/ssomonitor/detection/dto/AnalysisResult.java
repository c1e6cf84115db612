package com.ssomonitor.detection.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of {@code <analysis>_result}. A failed analysis carries {@code exception} and the delivery receipt,
 * a timed out one only the timeout marker.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {

    public static final String TIMEOUT_MARKER = "Process timeout";

    @JsonProperty("resolved")
    private ResolvedTarget resolved;

    @JsonProperty("login_page_candidates")
    private List<Candidate> loginPageCandidates;

    @JsonProperty("robots")
    private String robots;

    @JsonProperty("sitemap")
    private List<SitemapEntry> sitemap;

    @JsonProperty("strategy_errors")
    private Map<String, String> strategyErrors;

    @JsonProperty("exception")
    private String exception;

    @JsonProperty("candidate_delivery")
    private DeliveryReceipt candidateDelivery;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    public static AnalysisResult forTarget(ResolvedTarget resolved) {
        AnalysisResult result = new AnalysisResult();
        result.setResolved(resolved);
        result.setLoginPageCandidates(new ArrayList<>());
        return result;
    }

    public static AnalysisResult failure(String message) {
        AnalysisResult result = new AnalysisResult();
        result.setException(message == null ? "Unknown error" : message);
        return result;
    }

    public static AnalysisResult timeout() {
        return failure(TIMEOUT_MARKER);
    }

    public void addCandidates(Collection<Candidate> candidates) {
        if (loginPageCandidates == null) {
            loginPageCandidates = new ArrayList<>();
        }
        loginPageCandidates.addAll(candidates);
    }

    public void recordStrategyError(String strategy, String message) {
        if (strategyErrors == null) {
            strategyErrors = new LinkedHashMap<>();
        }
        strategyErrors.put(strategy, message);
    }

    @JsonIgnore
    public List<Candidate> candidatesOrEmpty() {
        return loginPageCandidates == null ? List.of() : loginPageCandidates;
    }

    @JsonIgnore
    public boolean isFailure() {
        return exception != null;
    }

    @JsonAnySetter
    public void setProperty(String name, Object value) {
        properties.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }
}
