package com.ssomonitor.detection.client;

import com.ssomonitor.detection.exception.ChatCompletionException;
import com.ssomonitor.detection.exception.ClassificationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a screenshot with a vision-language model behind an OpenAI-compatible endpoint.
 * The model reasons first and concludes with YES or NO, so the last standalone token decides.
 */
@Slf4j
public class ChatCompletionClassificationOracle implements ClassificationOracle {

    static final String SYSTEM_PROMPT = "You are a helpful assistant.";

    static final String LOGIN_FORM_PROMPT = """
            Analyze the provided image and determine if it contains input fields associated with the login flow of a web page. Specifically, look for:

            Username or email input fields (e.g., forms with user ID, unique user ID, email address, or similar fields).
            Password input fields (fields intended for password entry).
            Follow this structured approach:

            Identify all input fields in the image.
            Filter out irrelevant input fields, such as those related to search, comments, or non-login-related data collection.
            Determine if at least one relevant login-related input field is present and visible on the page.
            Explain your reasoning step by step (Chain of Thought) to justify your decision.
            Strictly output either "YES" or "NO" at the end, based on whether a login form containing at least one relevant input field is detected.
            Output Format (Important):
            After explaining your reasoning, respond strictly with either:

            "YES" (if a relevant login input field is present and visible).
            "NO" (if no relevant login input field is found).
            """;

    private static final Pattern VERDICT_TOKEN = Pattern.compile("\\b(YES|NO)\\b", Pattern.CASE_INSENSITIVE);

    private final ChatCompletionClient client;
    private final ImageUrlResolver imageUrlResolver;
    private final String model;
    private final int maxTokens;
    private final Integer minPixels;
    private final Integer maxPixels;

    public ChatCompletionClassificationOracle(ChatCompletionClient client, ImageUrlResolver imageUrlResolver,
                                              String model, int maxTokens, Integer minPixels, Integer maxPixels) {
        this.client = client;
        this.imageUrlResolver = imageUrlResolver;
        this.model = model;
        this.maxTokens = maxTokens;
        this.minPixels = minPixels;
        this.maxPixels = maxPixels;
    }

    @Override
    public ClassificationVerdict classify(String imageReference) {
        String imageUrl;
        try {
            imageUrl = imageUrlResolver.resolve(imageReference);
        } catch (RuntimeException e) {
            throw new ClassificationException("Cannot build image URL for " + imageReference + ": " + e.getMessage(), e);
        }

        List<Map<String, Object>> messages = List.of(
                ChatCompletionClient.systemMessage(SYSTEM_PROMPT),
                ChatCompletionClient.imageMessage(imageUrl, LOGIN_FORM_PROMPT, minPixels, maxPixels)
        );

        String text;
        try {
            text = client.complete(model, messages, Map.of("max_tokens", maxTokens));
        } catch (ChatCompletionException e) {
            throw new ClassificationException(e.getMessage(), e);
        }

        String verdict = extractVerdict(text);
        if (verdict == null) {
            throw ClassificationException.noVerdict(text);
        }
        log.debug("Model verdict for {}: {}", imageReference, verdict);
        return "YES".equals(verdict)
                ? ClassificationVerdict.loginPresent(text)
                : ClassificationVerdict.notPresent(text);
    }

    /**
     * Last standalone YES/NO token in {@code text}, upper-cased, or null if there is none.
     */
    static String extractVerdict(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = VERDICT_TOKEN.matcher(text);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        return last == null ? null : last.toUpperCase(Locale.ROOT);
    }
}
