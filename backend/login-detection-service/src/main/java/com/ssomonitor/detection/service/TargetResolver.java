package com.ssomonitor.detection.service;

import com.ssomonitor.detection.client.DiscoverySourceClient;
import com.ssomonitor.detection.client.DiscoverySourceClient.FetchedResource;
import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.exception.SourceFetchException;
import com.ssomonitor.detection.util.UrlHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Finds the landing URL of a domain: HTTPS first, then HTTP, following redirects.
 * An unreachable domain still resolves to {@code https://<domain>/} so the strategies can run.
 */
@Service
@Slf4j
public class TargetResolver {

    private final DiscoverySourceClient sourceClient;
    private final Duration timeout;

    @Autowired
    public TargetResolver(DiscoverySourceClient sourceClient, WorkerProperties properties) {
        this(sourceClient, properties.getResolver().getTimeout());
    }

    public TargetResolver(DiscoverySourceClient sourceClient, Duration timeout) {
        this.sourceClient = sourceClient;
        this.timeout = timeout;
    }

    public ResolvedTarget resolve(String domain) {
        String host = domain.trim();
        for (String scheme : List.of("https", "http")) {
            String url = scheme + "://" + host + "/";
            try {
                FetchedResource landing = sourceClient.fetch(url, timeout);
                String resolvedUrl = UrlHelper.normalize(landing.url());
                log.info("Resolved {} to {} (HTTP {})", domain, resolvedUrl, landing.status());
                return new ResolvedTarget(resolvedUrl, UrlHelper.host(resolvedUrl).orElse(host), true);
            } catch (SourceFetchException e) {
                log.warn("Could not reach {}: {}", url, e.getMessage());
            }
        }
        log.warn("Domain {} is unreachable, continuing with https://{}/", domain, host);
        return new ResolvedTarget("https://" + host + "/", host, false);
    }
}
