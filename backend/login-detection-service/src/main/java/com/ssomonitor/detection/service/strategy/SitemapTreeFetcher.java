package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.client.DiscoverySourceClient;
import com.ssomonitor.detection.client.DiscoverySourceClient.FetchedResource;
import com.ssomonitor.detection.dto.SitemapEntry;
import com.ssomonitor.detection.exception.SourceFetchException;
import com.ssomonitor.detection.util.UrlHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Walks a site's sitemap tree: sitemaps announced in robots.txt plus the well-known locations,
 * XML url sets, nested sitemap indexes, plain-text sitemaps and gzip-compressed variants.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SitemapTreeFetcher {

    static final List<String> WELL_KNOWN_PATHS = List.of("/sitemap.xml", "/sitemap_index.xml", "/sitemap.xml.gz");

    private static final double DEFAULT_PAGE_PRIORITY = 0.5;

    private final DiscoverySourceClient sourceClient;

    /**
     * @param maxRecursionLevel how many levels of sitemap indexes are followed below a root sitemap
     * @param maxSitemapSize    sitemaps larger than this many bytes (compressed or not) are skipped
     * @return every listed page, first occurrence per URL, in discovery order
     */
    public List<SitemapEntry> fetchTree(String homepageUrl, int maxRecursionLevel, long maxSitemapSize, Duration timeout) {
        String origin = UrlHelper.origin(homepageUrl);
        Walk walk = new Walk(maxRecursionLevel, maxSitemapSize, timeout);
        for (String root : rootSitemaps(origin, timeout)) {
            walk.visit(root, 0);
        }
        log.info("Sitemap tree of {} lists {} pages in {} sitemaps", origin, walk.pages.size(), walk.visited.size());
        return new ArrayList<>(walk.pages.values());
    }

    private Set<String> rootSitemaps(String origin, Duration timeout) {
        Set<String> roots = new LinkedHashSet<>();
        try {
            FetchedResource robots = sourceClient.fetch(origin + "/robots.txt", timeout);
            if (robots.isOk()) {
                roots.addAll(RobotsTxtParser.sitemaps(robots.bodyAsString()));
            }
        } catch (SourceFetchException e) {
            log.debug("No robots.txt for sitemap discovery on {}: {}", origin, e.getMessage());
        }
        for (String path : WELL_KNOWN_PATHS) {
            roots.add(origin + path);
        }
        return roots;
    }

    private final class Walk {

        private final int maxRecursionLevel;
        private final long maxSitemapSize;
        private final Duration timeout;
        private final Set<String> visited = new HashSet<>();
        private final Map<String, SitemapEntry> pages = new LinkedHashMap<>();

        private Walk(int maxRecursionLevel, long maxSitemapSize, Duration timeout) {
            this.maxRecursionLevel = maxRecursionLevel;
            this.maxSitemapSize = maxSitemapSize;
            this.timeout = timeout;
        }

        private void visit(String sitemapUrl, int level) {
            if (!visited.add(sitemapUrl)) {
                return;
            }
            FetchedResource resource;
            try {
                resource = sourceClient.fetch(sitemapUrl, timeout);
            } catch (SourceFetchException e) {
                log.info("Error while requesting sitemap {}: {}", sitemapUrl, e.getMessage());
                return;
            }
            if (!resource.isOk()) {
                log.debug("Sitemap {} answered with HTTP {}", sitemapUrl, resource.status());
                return;
            }
            byte[] body = resource.body();
            if (body.length > maxSitemapSize) {
                log.warn("Skipping sitemap {} of {} bytes (limit {})", sitemapUrl, body.length, maxSitemapSize);
                return;
            }
            String text;
            try {
                text = new String(isGzip(body) ? gunzip(body) : body, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Could not decompress sitemap {}: {}", sitemapUrl, e.getMessage());
                return;
            }

            String content = text.strip();
            if (content.startsWith("<")) {
                parseXml(sitemapUrl, content, level);
            } else {
                parseText(content);
            }
        }

        private void parseXml(String sitemapUrl, String xml, int level) {
            Document document = Jsoup.parse(xml, sitemapUrl, Parser.xmlParser());
            for (Element element : document.getAllElements()) {
                String name = localName(element);
                if ("sitemap".equals(name) && "sitemapindex".equals(parentName(element))) {
                    String loc = childText(element, "loc");
                    if (loc == null) {
                        continue;
                    }
                    if (level < maxRecursionLevel) {
                        visit(loc, level + 1);
                    } else {
                        log.debug("Not following sitemap {} beyond recursion level {}", loc, maxRecursionLevel);
                    }
                } else if ("url".equals(name) && "urlset".equals(parentName(element))) {
                    String loc = childText(element, "loc");
                    if (loc != null) {
                        pages.putIfAbsent(loc, toEntry(loc, element));
                    }
                }
            }
        }

        private void parseText(String text) {
            for (String line : text.split("\\r?\\n")) {
                String url = line.strip();
                if (url.startsWith("http://") || url.startsWith("https://")) {
                    pages.putIfAbsent(url, new SitemapEntry(url, DEFAULT_PAGE_PRIORITY, null, null, null));
                }
            }
        }

        private byte[] gunzip(byte[] body) throws IOException {
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                byte[] buffer = new byte[8192];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    if (out.size() > maxSitemapSize) {
                        throw new IOException("decompressed size exceeds " + maxSitemapSize + " bytes");
                    }
                }
                return out.toByteArray();
            }
        }
    }

    private static SitemapEntry toEntry(String loc, Element url) {
        Double priority = parsePriority(childText(url, "priority"));
        Long lastModified = parseTimestamp(childText(url, "lastmod"));
        String changeFrequency = childText(url, "changefreq");
        String newsStory = null;
        Element news = child(url, "news");
        if (news != null) {
            newsStory = childText(news, "title");
        }
        return new SitemapEntry(loc, priority, lastModified,
                changeFrequency == null ? null : changeFrequency.toLowerCase(Locale.ROOT), newsStory);
    }

    private static boolean isGzip(byte[] body) {
        return body.length > 2 && (body[0] & 0xff) == 0x1f && (body[1] & 0xff) == 0x8b;
    }

    private static Double parsePriority(String value) {
        if (value == null) {
            return DEFAULT_PAGE_PRIORITY;
        }
        try {
            double priority = Double.parseDouble(value);
            return priority >= 0.0 && priority <= 1.0 ? priority : DEFAULT_PAGE_PRIORITY;
        } catch (NumberFormatException e) {
            return DEFAULT_PAGE_PRIORITY;
        }
    }

    static Long parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            }
            return OffsetDateTime.parse(value).toEpochSecond();
        } catch (DateTimeParseException e) {
            log.debug("Unparsable sitemap lastmod '{}'", value);
            return null;
        }
    }

    private static String localName(Element element) {
        String name = element.tagName();
        int colon = name.indexOf(':');
        return (colon >= 0 ? name.substring(colon + 1) : name).toLowerCase(Locale.ROOT);
    }

    private static String parentName(Element element) {
        Element parent = element.parent();
        return parent == null ? null : localName(parent);
    }

    private static Element child(Element parent, String localName) {
        for (Element child : parent.children()) {
            if (localName.equals(localName(child))) {
                return child;
            }
        }
        return null;
    }

    private static String childText(Element parent, String localName) {
        Element child = child(parent, localName);
        if (child == null) {
            return null;
        }
        String text = child.text().strip();
        return text.isEmpty() ? null : text;
    }
}
