package com.ssomonitor.detection.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class UrlHelperTest {

    @ParameterizedTest
    @CsvSource({
            "HTTPS://Example.COM, https://example.com/",
            "https://example.com:443/login#form, https://example.com/login",
            "http://example.com:8080/a?b=c, http://example.com:8080/a?b=c",
            "'  https://example.com/Login  ', https://example.com/Login",
            "not a url, not a url"
    })
    @DisplayName("URL 정규화")
    void normalize(String input, String expected) {
        assertThat(UrlHelper.normalize(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("origin은 기본 포트를 생략한다")
    void origin() {
        assertThat(UrlHelper.origin("https://Example.com/a/b")).isEqualTo("https://example.com");
        assertThat(UrlHelper.origin("https://example.com:8443/a")).isEqualTo("https://example.com:8443");
    }

    @Test
    @DisplayName("등록 가능 도메인 (TLD+1)")
    void registrableDomain() {
        assertThat(UrlHelper.registrableDomain("login.example.co.uk")).isEqualTo("example.co.uk");
        assertThat(UrlHelper.registrableDomain("www.example.com.")).isEqualTo("example.com");
        assertThat(UrlHelper.registrableDomain("192.168.0.1")).isEqualTo("192.168.0.1");
        assertThat(UrlHelper.registrableDomain("localhost")).isEqualTo("localhost");
    }

    @Test
    @DisplayName("같은 등록 가능 도메인 여부")
    void sameRegistrableDomain() {
        assertThat(UrlHelper.isSameRegistrableDomain("https://auth.example.com/login", "www.example.com")).isTrue();
        assertThat(UrlHelper.isSameRegistrableDomain("https://example.org/login", "example.com")).isFalse();
        assertThat(UrlHelper.isSameRegistrableDomain("/relative/path", "example.com")).isFalse();
        assertThat(UrlHelper.isSameRegistrableDomain("https://example.com", null)).isFalse();
    }

    @Test
    @DisplayName("크롤러 사이트 디렉터리 이름")
    void siteDirectoryName() {
        assertThat(UrlHelper.siteDirectoryName("https://www.hancockwhitney.com")).isEqualTo("www_hancockwhitney_com");
        assertThat(UrlHelper.siteDirectoryName("http://example.com/")).isEqualTo("example_com_");
    }
}
