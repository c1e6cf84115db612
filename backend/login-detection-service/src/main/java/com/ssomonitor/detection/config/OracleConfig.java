package com.ssomonitor.detection.config;

import com.ssomonitor.detection.client.ChatCompletionClassificationOracle;
import com.ssomonitor.detection.client.ChatCompletionClient;
import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.client.ImageUrlResolver;
import com.ssomonitor.detection.client.SocketClassificationOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Locale;

/**
 * Selects the classification oracle transport from {@code worker.oracle.transport}.
 */
@Configuration
@Slf4j
public class OracleConfig {

    @Bean
    public ClassificationOracle classificationOracle(WorkerProperties properties, WebClient webClient) {
        WorkerProperties.Oracle oracle = properties.getOracle();
        String transport = oracle.getTransport().trim().toLowerCase(Locale.ROOT);
        switch (transport) {
            case "socket": {
                WorkerProperties.Oracle.Socket socket = oracle.getSocket();
                log.info("Classification oracle: socket {}:{}", socket.getHost(), socket.getPort());
                return new SocketClassificationOracle(socket.getHost(), socket.getPort(), socket.getTimeout(), socket.isNoSave());
            }
            case "chat-completion":
            case "chat_completion": {
                WorkerProperties.Oracle.Chat chat = oracle.getChat();
                log.info("Classification oracle: chat completion {} model={}", chat.getBaseUrl(), chat.getModel());
                ChatCompletionClient client = new ChatCompletionClient(webClient, chat.getBaseUrl(), chat.getApiKey(), chat.getTimeout());
                return new ChatCompletionClassificationOracle(client,
                        new ImageUrlResolver(chat.getImageBaseUrl(), chat.getPathMarker()),
                        chat.getModel(), chat.getMaxTokens(), chat.getMinPixels(), chat.getMaxPixels());
            }
            default:
                throw new IllegalStateException("Unknown worker.oracle.transport: " + oracle.getTransport());
        }
    }
}
