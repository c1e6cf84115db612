package com.ssomonitor.detection.client;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.dto.CandidateSubmission;
import com.ssomonitor.detection.dto.DeliveryReceipt;
import com.ssomonitor.detection.exception.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submits merged candidates to the collector. Best effort: one retry after a fixed delay, never throws.
 */
@Component
@Slf4j
public class CandidateCollectorClient {

    private static final int MAX_RETRIES = 1;

    private final WebClient webClient;
    private final String endpoint;
    private final Duration retryDelay;
    private final Duration timeout;

    @Autowired
    public CandidateCollectorClient(WebClient webClient, WorkerProperties properties) {
        this(webClient,
                properties.getDelivery().getCollector().getBaseUrl() + properties.getDelivery().getCollector().getPath(),
                properties.getDelivery().getCollector().getRetryDelay(),
                properties.getDelivery().getCollector().getTimeout());
    }

    public CandidateCollectorClient(WebClient webClient, String endpoint, Duration retryDelay, Duration timeout) {
        this.webClient = webClient;
        this.endpoint = endpoint;
        this.retryDelay = retryDelay;
        this.timeout = timeout;
    }

    public DeliveryReceipt submit(CandidateSubmission submission) {
        AtomicInteger attempts = new AtomicInteger();
        log.info("Submitting {} login page candidates of task {} to {}",
                submission.candidates().size(), submission.taskId(), endpoint);

        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return webClient.post()
                            .uri(URI.create(endpoint))
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(submission)
                            .exchangeToMono(resp -> {
                                int status = resp.statusCode().value();
                                if (status == 200) {
                                    return resp.releaseBody().thenReturn(status);
                                }
                                return resp.bodyToMono(String.class)
                                        .defaultIfEmpty("")
                                        .flatMap(body -> Mono.error(DeliveryException.unexpectedStatus(endpoint, status, body)));
                            })
                            .timeout(timeout);
                })
                .retryWhen(Retry.fixedDelay(MAX_RETRIES, retryDelay)
                        .doBeforeRetry(signal -> log.warn("Collector submission for task {} failed, retrying in {}: {}",
                                submission.taskId(), retryDelay, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(status -> {
                    log.info("Collector accepted candidates of task {} (HTTP {})", submission.taskId(), status);
                    return DeliveryReceipt.success(status, attempts.get());
                })
                .onErrorResume(e -> {
                    DeliveryException failure = toDeliveryException(e);
                    log.error("Giving up collector submission for task {} after {} attempts: {}",
                            submission.taskId(), attempts.get(), failure.getMessage());
                    return Mono.just(DeliveryReceipt.failure(failure.getStatusCode(), failure.getMessage(), attempts.get()));
                })
                .block();
    }

    private DeliveryException toDeliveryException(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof DeliveryException) {
            return (DeliveryException) cause;
        }
        return DeliveryException.transport(endpoint, cause);
    }
}
