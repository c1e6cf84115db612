package com.ssomonitor.detection.exception;

/**
 * A discovery source (robots.txt, sitemap, metasearch) could not be fetched.
 */
public class SourceFetchException extends WorkerException {

    public SourceFetchException(String message) {
        super("SOURCE_FETCH_ERROR", message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super("SOURCE_FETCH_ERROR", message, cause);
    }

    public static SourceFetchException failed(String url, Throwable cause) {
        return new SourceFetchException("Could not fetch " + url + ": " + cause.getMessage(), cause);
    }

    public static SourceFetchException tooManyRedirects(String url, int maxRedirects) {
        return new SourceFetchException("More than " + maxRedirects + " redirects while fetching " + url);
    }
}
