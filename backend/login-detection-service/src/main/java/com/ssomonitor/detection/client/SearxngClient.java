package com.ssomonitor.detection.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.exception.SourceFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * SearXNG JSON search API.
 */
@Component
@Slf4j
public class SearxngClient {

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;

    @Autowired
    public SearxngClient(WebClient webClient, WorkerProperties properties) {
        this(webClient, properties.getSearxng().getBaseUrl(), properties.getSearxng().getTimeout());
    }

    public SearxngClient(WebClient webClient, String baseUrl, Duration timeout) {
        this.webClient = webClient;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }

    /**
     * Fetches one result page.
     *
     * @param engines comma separated engine names in the order they are sent
     * @throws SourceFetchException on a non-200 status or transport error
     */
    public SearchPage search(String query, String engines, int pageNo) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("q", query)
                .queryParam("engines", engines)
                .queryParam("safesearch", 0)
                .queryParam("format", "json")
                .queryParam("pageno", pageNo)
                .encode()
                .build()
                .toUri();
        log.info("Requesting searxng results on page #{}: {}", pageNo, uri);

        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(resp -> {
                        if (resp.statusCode().value() != 200) {
                            return resp.releaseBody().then(Mono.error(new SourceFetchException(
                                    "Searxng answered with HTTP " + resp.statusCode().value())));
                        }
                        return resp.bodyToMono(JsonNode.class);
                    })
                    .timeout(timeout)
                    .block();
        } catch (SourceFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SourceFetchException.failed(uri.toString(), e);
        }

        List<JsonNode> results = new ArrayList<>();
        List<String> unresponsive = new ArrayList<>();
        if (body != null) {
            body.path("results").forEach(results::add);
            body.path("unresponsive_engines").forEach(engine -> unresponsive.add(engine.toString()));
        }
        return new SearchPage(results, unresponsive);
    }

    public record SearchPage(List<JsonNode> results, List<String> unresponsiveEngines) {
    }
}
