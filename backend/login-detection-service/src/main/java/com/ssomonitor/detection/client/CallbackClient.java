package com.ssomonitor.detection.client;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.exception.DeliveryException;
import com.ssomonitor.detection.metrics.WorkerMetrics;
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

/**
 * PUTs the full task document to the requester's callback. Blocks until the callback answers 200;
 * every failure is retried after a fixed backoff, without limit.
 */
@Component
@Slf4j
public class CallbackClient {

    private final WebClient webClient;
    private final WorkerMetrics metrics;
    private final String brainUrl;
    private final String username;
    private final String password;
    private final Duration retryBackoff;
    private final Duration timeout;

    @Autowired
    public CallbackClient(WebClient webClient, WorkerMetrics metrics, WorkerProperties properties) {
        this(webClient, metrics,
                properties.getDelivery().getCallback().getBrainUrl(),
                properties.getDelivery().getCallback().getUsername(),
                properties.getDelivery().getCallback().getPassword(),
                properties.getDelivery().getCallback().getRetryBackoff(),
                properties.getDelivery().getCallback().getTimeout());
    }

    public CallbackClient(WebClient webClient, WorkerMetrics metrics, String brainUrl, String username,
                          String password, Duration retryBackoff, Duration timeout) {
        this.webClient = webClient;
        this.metrics = metrics;
        this.brainUrl = brainUrl;
        this.username = username;
        this.password = password;
        this.retryBackoff = retryBackoff;
        this.timeout = timeout;
    }

    /**
     * @param replyTo  callback path appended to the brain URL
     * @param taskJson complete task document
     * @return number of attempts it took
     */
    public int putResult(String replyTo, String taskJson) {
        URI target = URI.create(brainUrl + replyTo);
        int[] attempts = {0};

        Mono.defer(() -> {
                    attempts[0]++;
                    return webClient.put()
                            .uri(target)
                            .headers(headers -> {
                                if (username != null && !username.isEmpty()) {
                                    headers.setBasicAuth(username, password);
                                }
                            })
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(taskJson)
                            .exchangeToMono(resp -> {
                                int status = resp.statusCode().value();
                                if (status == 200) {
                                    return resp.releaseBody().thenReturn(status);
                                }
                                return resp.bodyToMono(String.class)
                                        .defaultIfEmpty("")
                                        .flatMap(body -> Mono.error(DeliveryException.unexpectedStatus(target.toString(), status, body)));
                            })
                            .timeout(timeout);
                })
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, retryBackoff)
                        .doBeforeRetry(signal -> {
                            metrics.callbackRetry();
                            log.warn("Callback PUT to {} failed (attempt {}), retrying in {}: {}",
                                    target, signal.totalRetries() + 1, retryBackoff,
                                    Exceptions.unwrap(signal.failure()).getMessage());
                        }))
                .block();

        log.info("Callback PUT to {} succeeded after {} attempt(s)", target, attempts[0]);
        return attempts[0];
    }
}
