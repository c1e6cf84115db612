package com.ssomonitor.detection.backend;

import com.ssomonitor.detection.client.ChatCompletionClient;
import com.ssomonitor.detection.client.ImageUrlResolver;
import com.ssomonitor.detection.exception.ChatCompletionException;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * State of one crawler connection to the guidance server. The first screenshot is checked for popups
 * and cookie banners, every later one for the element that leads to the login page.
 * Not thread safe; the server feeds it one request at a time.
 */
@Slf4j
public class CrawlSession {

    enum Stage {
        CHECK_POPUPS,
        FIND_LOGIN
    }

    static final String SYSTEM_PROMPT = "You are a helpful assistant.";

    static final String POPUP_PROMPT = """
            Analyze the provided image and determine if there are any visible popups or cookie banners.
            If a popup is detected, where do I click to close it. Give me the coordinates of a cross icon in order to close it. If this does not exist give me the coordinates of the button inside the popup that exists.
            If a cookie banner is detected return the position of the large Accept button inside a colored shape, for example oval or square.
            If no popup or cookie banner exists Output: "No popups found".
            Output Format:
            Element Type: [Popup/Cookie Banner]
            Description: [Brief description]
            Bounding Box Coordinates: (x1, y1, x2, y2)
            Guidelines:
            - Only focus on popups or cookie banners.
            - Provide precise bounding box coordinates.
            """;

    static final String LOGIN_PROMPT = """
            Analyze the provided image and identify where do I click to access the login page. This may be an element labeled abstractly like Online Banking, My Account, Login or a person icon or even a form submit button associated with login credentials etc.
            Output Format:
            Element Type: Login Button
            Description: [Brief description]
            Bounding Box Coordinates: (x1, y1, x2, y2)
            Guidelines:
            - Only focus on the element that takes me to the login page.
            - Provide precise bounding box coordinates.
            """;

    static final Pattern BOUNDING_BOX =
            Pattern.compile("Bounding Box Coordinates:\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");

    /** Models answer on a 0..1000 grid regardless of the image size */
    static final double MODEL_GRID = 1000.0;

    static final String NO_POPUPS = "No popups found";
    static final String NO_ELEMENT = "Error: No relevant element detected.";

    private static final Map<String, Object> SAMPLING = Map.of(
            "max_tokens", 512,
            "temperature", 0.01,
            "top_p", 0.001
    );

    private final ChatCompletionClient chatClient;
    private final ImageUrlResolver imageUrlResolver;
    private final String model;
    private final Path imageRoot;

    private Stage stage = Stage.CHECK_POPUPS;
    private String lastImage;

    /**
     * @param imageRoot directory that relative screenshot paths sent by the crawler are resolved against
     */
    public CrawlSession(ChatCompletionClient chatClient, ImageUrlResolver imageUrlResolver, String model, Path imageRoot) {
        this.chatClient = chatClient;
        this.imageUrlResolver = imageUrlResolver;
        this.model = model;
        this.imageRoot = imageRoot;
    }

    public String handle(String screenshotPath) {
        Path file = imageRoot.resolve(screenshotPath);
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            return "Error: Could not open image. " + e.getMessage();
        }
        if (image == null) {
            return "Error: Could not open image. Unsupported format: " + file;
        }

        lastImage = file.toString();
        String prompt = stage == Stage.CHECK_POPUPS ? POPUP_PROMPT : LOGIN_PROMPT;
        stage = Stage.FIND_LOGIN;

        String output;
        try {
            output = chatClient.complete(model, List.of(
                    ChatCompletionClient.systemMessage(SYSTEM_PROMPT),
                    ChatCompletionClient.imageMessage(imageUrlResolver.resolve(lastImage), prompt, null, null)
            ), SAMPLING);
        } catch (ChatCompletionException | IllegalArgumentException e) {
            log.error("Guidance inference failed for {}: {}", file, e.getMessage());
            return "Inference error: " + e.getMessage();
        }
        log.debug("Guidance model output for {}: {}", file, output);
        return clickReply(output, image.getWidth(), image.getHeight());
    }

    Stage getStage() {
        return stage;
    }

    String getLastImage() {
        return lastImage;
    }

    /**
     * Click point at the centre of the first bounding box in {@code output}, scaled to the image size.
     */
    static String clickReply(String output, int width, int height) {
        Matcher matcher = BOUNDING_BOX.matcher(output);
        if (!matcher.find()) {
            return output.contains(NO_POPUPS) ? NO_POPUPS : NO_ELEMENT;
        }
        int x1 = scale(matcher.group(1), width);
        int y1 = scale(matcher.group(2), height);
        int x2 = scale(matcher.group(3), width);
        int y2 = scale(matcher.group(4), height);
        return "Click Point: " + Math.floorDiv(x1 + x2, 2) + ", " + Math.floorDiv(y1 + y2, 2);
    }

    private static int scale(String gridValue, int pixels) {
        return (int) (Integer.parseInt(gridValue) / MODEL_GRID * pixels);
    }
}
