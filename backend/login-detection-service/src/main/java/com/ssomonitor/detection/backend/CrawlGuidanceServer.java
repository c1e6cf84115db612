package com.ssomonitor.detection.backend;

import com.ssomonitor.detection.client.ChatCompletionClient;
import com.ssomonitor.detection.client.ImageUrlResolver;
import com.ssomonitor.detection.config.WorkerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Tells the crawler where to click next. Each connection gets its own {@link CrawlSession}, which lives
 * exactly as long as the connection; requests of a connection are answered strictly in order.
 */
@Component
@ConditionalOnProperty(name = "worker.backend.guidance.enabled", havingValue = "true")
@Slf4j
public class CrawlGuidanceServer extends LineProtocolServer {

    private final Supplier<CrawlSession> sessionFactory;

    @Autowired
    public CrawlGuidanceServer(WorkerProperties properties, WebClient webClient) {
        this(properties.getBackend().getGuidance().getHost(),
                properties.getBackend().getGuidance().getPort(),
                sessionFactory(properties, webClient));
    }

    public CrawlGuidanceServer(String host, int port, Supplier<CrawlSession> sessionFactory) {
        super("Crawl guidance server", host, port);
        this.sessionFactory = sessionFactory;
    }

    private static Supplier<CrawlSession> sessionFactory(WorkerProperties properties, WebClient webClient) {
        WorkerProperties.Backend.Guidance guidance = properties.getBackend().getGuidance();
        ChatCompletionClient client = new ChatCompletionClient(webClient, guidance.getBaseUrl(),
                guidance.getApiKey(), guidance.getTimeout());
        ImageUrlResolver resolver = new ImageUrlResolver(guidance.getImageBaseUrl(), guidance.getPathMarker());
        Path imageRoot = Path.of(properties.getCrawler().getWorkingDirectory()).toAbsolutePath();
        return () -> new CrawlSession(client, resolver, guidance.getModel(), imageRoot);
    }

    @Override
    protected Flux<String> replies(Flux<String> requests) {
        CrawlSession session = sessionFactory.get();
        return requests.concatMap(path -> Mono.fromCallable(() -> {
                    log.info("Guidance request for {}", path);
                    String reply = session.handle(path);
                    log.info("Guidance reply: {}", reply);
                    return reply;
                })
                .subscribeOn(Schedulers.boundedElastic()));
    }

    @PostConstruct
    @Override
    public void start() {
        super.start();
    }

    @PreDestroy
    @Override
    public void stop() {
        super.stop();
    }
}
