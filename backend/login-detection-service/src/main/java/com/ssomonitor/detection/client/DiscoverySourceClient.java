package com.ssomonitor.detection.client;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.exception.SourceFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Plain GET for site resources. Redirects are followed here so callers learn the final URL.
 */
@Component
@Slf4j
public class DiscoverySourceClient {

    private final WebClient webClient;
    private final int maxRedirects;

    @Autowired
    public DiscoverySourceClient(@Qualifier("discoveryWebClient") WebClient webClient, WorkerProperties properties) {
        this(webClient, properties.getResolver().getMaxRedirects());
    }

    public DiscoverySourceClient(WebClient webClient, int maxRedirects) {
        this.webClient = webClient;
        this.maxRedirects = maxRedirects;
    }

    /**
     * @throws SourceFetchException on connection errors, timeouts, oversized bodies or redirect loops
     */
    public FetchedResource fetch(String url, Duration timeout) {
        String current = url;
        for (int hop = 0; hop <= maxRedirects; hop++) {
            Response response = fetchOnce(current, timeout);
            if (response.isRedirect()) {
                String next = resolveRedirect(current, response.location());
                log.debug("Following redirect {} -> {}", current, next);
                current = next;
                continue;
            }
            return new FetchedResource(current, response.status(), response.contentType(), response.body());
        }
        throw SourceFetchException.tooManyRedirects(url, maxRedirects);
    }

    private static String resolveRedirect(String current, String location) {
        try {
            return URI.create(current).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw SourceFetchException.failed(current, e);
        }
    }

    private Response fetchOnce(String url, Duration timeout) {
        try {
            Response response = webClient.get()
                    .uri(URI.create(url))
                    .exchangeToMono(resp -> resp.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(body -> new Response(
                                    resp.statusCode().value(),
                                    resp.headers().contentType().map(MediaType::toString).orElse(null),
                                    resp.headers().header(HttpHeaders.LOCATION).stream().findFirst().orElse(null),
                                    body)))
                    .timeout(timeout)
                    .block();
            if (response == null) {
                throw new SourceFetchException("Empty response for " + url);
            }
            return response;
        } catch (SourceFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SourceFetchException.failed(url, e);
        }
    }

    private record Response(int status, String contentType, String location, byte[] body) {

        boolean isRedirect() {
            return status >= 300 && status < 400 && location != null && !location.isBlank();
        }
    }

    /**
     * @param url the URL that produced this response after redirects
     */
    public record FetchedResource(String url, int status, String contentType, byte[] body) {

        public boolean isOk() {
            return status == 200;
        }

        public boolean hasContentType(String expected) {
            return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(expected);
        }

        public String bodyAsString() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
