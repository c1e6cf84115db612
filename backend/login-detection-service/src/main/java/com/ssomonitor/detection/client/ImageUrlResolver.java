package com.ssomonitor.detection.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Turns a screenshot reference into a URL a remote model can load.
 * Paths below the marker directory map onto the image base URL; other local files are inlined as data URLs.
 */
public class ImageUrlResolver {

    private final String imageBaseUrl;
    private final String pathMarker;

    public ImageUrlResolver(String imageBaseUrl, String pathMarker) {
        this.imageBaseUrl = imageBaseUrl.endsWith("/") ? imageBaseUrl.substring(0, imageBaseUrl.length() - 1) : imageBaseUrl;
        this.pathMarker = pathMarker;
    }

    public String resolve(String imageReference) {
        String reference = imageReference.trim();
        if (reference.startsWith("http://") || reference.startsWith("https://") || reference.startsWith("data:")) {
            return reference;
        }
        int idx = reference.indexOf(pathMarker);
        if (idx >= 0) {
            String relative = reference.substring(idx + pathMarker.length());
            while (relative.startsWith("/")) {
                relative = relative.substring(1);
            }
            return imageBaseUrl + "/" + relative;
        }
        Path file = Path.of(reference);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Screenshot '" + reference + "' is neither below '" + pathMarker
                    + "' nor a readable file");
        }
        try {
            return "data:image/png;base64," + Base64.getEncoder().encodeToString(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read screenshot " + reference, e);
        }
    }
}
