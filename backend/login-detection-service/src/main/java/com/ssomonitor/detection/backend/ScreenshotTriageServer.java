package com.ssomonitor.detection.backend;

import com.ssomonitor.detection.client.ChatCompletionClassificationOracle;
import com.ssomonitor.detection.client.ChatCompletionClient;
import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.client.ClassificationVerdict;
import com.ssomonitor.detection.client.ImageUrlResolver;
import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.exception.WorkerException;
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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Classifies the screenshots the crawler takes. A screenshot showing a login form is copied from the raw
 * flows tree into the classified tree, the directory the crawling strategy later reads.
 * One request per connection.
 */
@Component
@ConditionalOnProperty(name = "worker.backend.triage.enabled", havingValue = "true")
@Slf4j
public class ScreenshotTriageServer extends LineProtocolServer {

    private static final String NO_SAVE_FLAG = " noSave";

    private final ClassificationOracle oracle;
    private final Path baseDirectory;
    private final String rawDirectoryName;
    private final String classifiedDirectoryName;

    @Autowired
    public ScreenshotTriageServer(WorkerProperties properties, WebClient webClient) {
        this(properties.getBackend().getTriage().getHost(),
                properties.getBackend().getTriage().getPort(),
                chatOracle(properties.getOracle().getChat(), webClient),
                Path.of(properties.getCrawler().getWorkingDirectory()).toAbsolutePath(),
                properties.getCrawler().getRawDirectory(),
                properties.getCrawler().getClassifiedDirectory());
    }

    public ScreenshotTriageServer(String host, int port, ClassificationOracle oracle, Path baseDirectory,
                                  String rawDirectoryName, String classifiedDirectoryName) {
        super("Screenshot triage server", host, port);
        this.oracle = oracle;
        this.baseDirectory = baseDirectory;
        this.rawDirectoryName = rawDirectoryName;
        this.classifiedDirectoryName = classifiedDirectoryName;
    }

    private static ClassificationOracle chatOracle(WorkerProperties.Oracle.Chat chat, WebClient webClient) {
        return new ChatCompletionClassificationOracle(
                new ChatCompletionClient(webClient, chat.getBaseUrl(), chat.getApiKey(), chat.getTimeout()),
                new ImageUrlResolver(chat.getImageBaseUrl(), chat.getPathMarker()),
                chat.getModel(), chat.getMaxTokens(), chat.getMinPixels(), chat.getMaxPixels());
    }

    @Override
    protected Flux<String> replies(Flux<String> requests) {
        return requests.take(1)
                .concatMap(request -> Mono.fromCallable(() -> triage(request))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    String triage(String request) {
        boolean noSave = request.endsWith(NO_SAVE_FLAG);
        String screenshot = noSave ? request.substring(0, request.length() - NO_SAVE_FLAG.length()).trim() : request;
        log.info("Received image path: {}", screenshot);

        ClassificationVerdict verdict;
        try {
            verdict = oracle.classify(screenshot);
        } catch (WorkerException | IllegalArgumentException | UncheckedIOException e) {
            log.warn("Classification of {} failed: {}", screenshot, e.getMessage());
            return "Error: Classification failed";
        }
        if (!verdict.isLoginPresent()) {
            log.info("Classification: NO for {}", screenshot);
            return "Classification: NO";
        }
        if (noSave) {
            return "Classification: YES";
        }

        Path source = baseDirectory.resolve(screenshot);
        Path target = classifiedPath(source);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Could not save classified screenshot {} to {}: {}", source, target, e.getMessage());
            return "Error: Classification failed";
        }
        String reply = "Classification: YES, image saved to " + target;
        log.info(reply);
        return reply;
    }

    /**
     * Same path with the raw flows directory segment replaced by the classified one.
     */
    Path classifiedPath(Path source) {
        Path normalized = source.normalize();
        Path result = normalized.getRoot() == null ? Path.of("") : normalized.getRoot();
        boolean replaced = false;
        for (Path segment : normalized) {
            if (!replaced && segment.toString().equals(rawDirectoryName)) {
                result = result.resolve(classifiedDirectoryName);
                replaced = true;
            } else {
                result = result.resolve(segment);
            }
        }
        if (!replaced) {
            log.warn("{} is not below a '{}' directory, saving it at the classified root", source, rawDirectoryName);
            return baseDirectory.resolve(classifiedDirectoryName).resolve(normalized.getFileName());
        }
        return result;
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
