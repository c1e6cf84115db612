package com.ssomonitor.detection.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ssomonitor.detection.exception.ChatCompletionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal OpenAI-compatible {@code /chat/completions} client returning the first choice's message text.
 */
@Slf4j
public class ChatCompletionClient {

    private final WebClient webClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public ChatCompletionClient(WebClient webClient, String baseUrl, String apiKey, Duration timeout) {
        this.webClient = webClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    public static Map<String, Object> systemMessage(String text) {
        return Map.of("role", "system", "content", text);
    }

    /**
     * User turn made of one image and one instruction text.
     */
    public static Map<String, Object> imageMessage(String imageUrl, String text, Integer minPixels, Integer maxPixels) {
        Map<String, Object> image = new LinkedHashMap<>();
        image.put("url", imageUrl);
        Map<String, Object> imagePart = new LinkedHashMap<>();
        imagePart.put("type", "image_url");
        imagePart.put("image_url", image);
        if (minPixels != null) {
            imagePart.put("min_pixels", minPixels);
        }
        if (maxPixels != null) {
            imagePart.put("max_pixels", maxPixels);
        }
        return Map.of(
                "role", "user",
                "content", List.of(imagePart, Map.of("type", "text", "text", text))
        );
    }

    /**
     * @param options extra request fields such as {@code max_tokens} or {@code temperature}
     */
    public String complete(String model, List<Map<String, Object>> messages, Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.putAll(options);

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(baseUrl + "/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            headers.setBearerAuth(apiKey);
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new ChatCompletionException("Chat completion at " + baseUrl + " answered with HTTP "
                    + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            // timeouts and connection errors surface unchecked from block()
            throw new ChatCompletionException("Chat completion at " + baseUrl + " failed: " + e.getMessage(), e);
        }

        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw new ChatCompletionException("Chat completion at " + baseUrl + " returned no message content");
        }
        String text = content.asText().trim();
        log.debug("Chat completion from {} ({} chars)", model, text.length());
        return text;
    }
}
