package com.ssomonitor.detection.util;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL normalisation and registrable-domain (TLD+1) matching.
 */
public final class UrlHelper {

    private UrlHelper() {}

    /**
     * Lower-cases scheme and host, drops the fragment and default ports, and turns an empty path into "/".
     * Values that are not absolute http(s) URLs are returned trimmed but otherwise unchanged.
     */
    public static String normalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return trimmed;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        sb.append(uri.getHost().toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * Host of an absolute URL, lower-cased.
     */
    public static Optional<String> host(String url) {
        if (url == null) {
            return Optional.empty();
        }
        try {
            String host = new URI(url.trim()).getHost();
            return Optional.ofNullable(host).map(h -> h.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * Scheme, host and non-default port of an absolute URL, e.g. {@code https://example.com:8443}.
     */
    public static String origin(String url) {
        URI uri = URI.create(url.trim());
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String origin = scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT);
        if (uri.getPort() != -1 && !isDefaultPort(scheme, uri.getPort())) {
            origin += ":" + uri.getPort();
        }
        return origin;
    }

    /**
     * Registrable domain of a host name, e.g. {@code login.example.co.uk -> example.co.uk}.
     * IP addresses and hosts without a known public suffix are returned as they are.
     */
    public static String registrableDomain(String host) {
        String normalized = stripTrailingDot(host.trim().toLowerCase(Locale.ROOT));
        if (InetAddresses.isInetAddress(normalized)) {
            return normalized;
        }
        try {
            InternetDomainName name = InternetDomainName.from(normalized);
            if (name.isUnderPublicSuffix()) {
                return name.topPrivateDomain().toString();
            }
            return normalized;
        } catch (IllegalArgumentException | IllegalStateException e) {
            return normalized;
        }
    }

    /**
     * Whether {@code url} belongs to the same registrable domain as {@code referenceHost}.
     */
    public static boolean isSameRegistrableDomain(String url, String referenceHost) {
        if (referenceHost == null) {
            return false;
        }
        return host(url)
                .map(h -> registrableDomain(h).equals(registrableDomain(referenceHost)))
                .orElse(false);
    }

    /**
     * File name fragment for a URL: {@code https://a.com/x} becomes {@code https_a.com_x}.
     */
    public static String sanitizeForFilename(String url) {
        String sanitized = url.replace("://", "_").replace("/", "_").replaceAll("[^A-Za-z0-9._-]", "_");
        return sanitized.length() > 150 ? sanitized.substring(0, 150) : sanitized;
    }

    /**
     * Directory name the crawler uses for a site: scheme removed, every non-word character replaced by "_".
     */
    public static String siteDirectoryName(String url) {
        return url.trim().replaceFirst("^[A-Za-z][A-Za-z0-9+.-]*://", "").replaceAll("\\W", "_");
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private static String stripTrailingDot(String host) {
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }
}
