package com.ssomonitor.detection.service.strategy;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Extracts Allow/Disallow paths and Sitemap URLs from robots.txt. Other directives are ignored.
 */
public final class RobotsTxtParser {

    private RobotsTxtParser() {}

    /**
     * @param path decoded path, always starting with "/"
     * @param stm  {@code allow} or {@code disallow}
     */
    public record RobotsPath(String stm, String path) {
    }

    public static List<RobotsPath> paths(String robotsTxt) {
        List<RobotsPath> paths = new ArrayList<>();
        for (String[] directive : directives(robotsTxt)) {
            String key = directive[0];
            if (!"allow".equals(key) && !"disallow".equals(key)) {
                continue;
            }
            String value = decode(directive[1]);
            if (value.startsWith("/")) {
                paths.add(new RobotsPath(key, value));
            }
        }
        return paths;
    }

    public static List<String> sitemaps(String robotsTxt) {
        List<String> sitemaps = new ArrayList<>();
        for (String[] directive : directives(robotsTxt)) {
            if ("sitemap".equals(directive[0]) && !directive[1].isEmpty()) {
                sitemaps.add(directive[1]);
            }
        }
        return sitemaps;
    }

    private static List<String[]> directives(String robotsTxt) {
        List<String[]> directives = new ArrayList<>();
        for (String line : robotsTxt.split("\n")) {
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.strip();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon < 0) {
                continue;
            }
            directives.add(new String[]{
                    line.substring(0, colon).strip().toLowerCase(Locale.ROOT),
                    line.substring(colon + 1).strip()
            });
        }
        return directives;
    }

    private static String decode(String value) {
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
