package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.client.DiscoverySourceClient;
import com.ssomonitor.detection.client.DiscoverySourceClient.FetchedResource;
import com.ssomonitor.detection.dto.SitemapEntry;
import com.ssomonitor.detection.exception.SourceFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class SitemapTreeFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private DiscoverySourceClient sourceClient;

    private SitemapTreeFetcher fetcher;
    private final Map<String, byte[]> site = new HashMap<>();

    @BeforeEach
    void setUp() {
        fetcher = new SitemapTreeFetcher(sourceClient);
        lenient().when(sourceClient.fetch(anyString(), any())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.endsWith("/robots.txt") && !site.containsKey(url)) {
                throw new SourceFetchException("connection reset");
            }
            byte[] body = site.get(url);
            return body == null
                    ? new FetchedResource(url, 404, "text/html", new byte[0])
                    : new FetchedResource(url, 200, "application/xml", body);
        });
    }

    @Test
    @DisplayName("사이트맵 인덱스를 따라가며 페이지를 수집한다")
    void followsSitemapIndex() {
        // given
        put("https://example.com/sitemap.xml", """
                <?xml version="1.0" encoding="UTF-8"?>
                <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <sitemap><loc>https://example.com/pages.xml</loc></sitemap>
                </sitemapindex>
                """);
        put("https://example.com/pages.xml", """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <url>
                    <loc>https://example.com/login</loc>
                    <lastmod>2024-01-15</lastmod>
                    <changefreq>Weekly</changefreq>
                    <priority>0.8</priority>
                  </url>
                  <url><loc>https://example.com/about</loc></url>
                  <url><loc>https://example.com/login</loc></url>
                </urlset>
                """);

        // when
        List<SitemapEntry> pages = fetcher.fetchTree("https://example.com/", 3, 1_000_000, TIMEOUT);

        // then
        assertThat(pages).extracting(SitemapEntry::url)
                .containsExactly("https://example.com/login", "https://example.com/about");
        SitemapEntry login = pages.get(0);
        assertThat(login.priority()).isEqualTo(0.8);
        assertThat(login.changeFrequency()).isEqualTo("weekly");
        assertThat(login.lastModified())
                .isEqualTo(LocalDate.of(2024, 1, 15).atStartOfDay(ZoneOffset.UTC).toEpochSecond());
        assertThat(pages.get(1).priority()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("재귀 깊이 제한을 넘는 인덱스는 따라가지 않는다")
    void respectsRecursionLimit() {
        // given
        put("https://example.com/sitemap.xml", """
                <sitemapindex><sitemap><loc>https://example.com/pages.xml</loc></sitemap></sitemapindex>
                """);
        put("https://example.com/pages.xml", "<urlset><url><loc>https://example.com/login</loc></url></urlset>");

        // when / then
        assertThat(fetcher.fetchTree("https://example.com/", 0, 1_000_000, TIMEOUT)).isEmpty();
    }

    @Test
    @DisplayName("robots.txt의 Sitemap, gzip, 텍스트 사이트맵")
    void robotsGzipAndTextSitemaps() throws IOException {
        // given
        site.put("https://example.com/robots.txt",
                "Sitemap: https://example.com/custom.txt\n".getBytes(StandardCharsets.UTF_8));
        put("https://example.com/custom.txt", "https://example.com/signin\nnot-a-url\n");
        site.put("https://example.com/sitemap.xml.gz",
                gzip("<urlset><url><loc>https://example.com/account</loc></url></urlset>"));

        // when
        List<SitemapEntry> pages = fetcher.fetchTree("https://example.com/", 3, 1_000_000, TIMEOUT);

        // then
        assertThat(pages).extracting(SitemapEntry::url)
                .containsExactly("https://example.com/signin", "https://example.com/account");
    }

    @Test
    @DisplayName("크기 제한을 넘는 사이트맵은 건너뛴다")
    void skipsOversizedSitemaps() {
        // given
        put("https://example.com/sitemap.xml", "<urlset><url><loc>https://example.com/login</loc></url></urlset>");

        // when / then
        assertThat(fetcher.fetchTree("https://example.com/", 3, 10, TIMEOUT)).isEmpty();
    }

    @Test
    @DisplayName("lastmod 파싱")
    void parsesTimestamps() {
        assertThat(SitemapTreeFetcher.parseTimestamp("2024-01-15T10:00:00+00:00"))
                .isEqualTo(LocalDate.of(2024, 1, 15).atStartOfDay(ZoneOffset.UTC).toEpochSecond() + 36_000);
        assertThat(SitemapTreeFetcher.parseTimestamp("yesterday")).isNull();
        assertThat(SitemapTreeFetcher.parseTimestamp(null)).isNull();
    }

    private void put(String url, String body) {
        site.put(url, body.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
