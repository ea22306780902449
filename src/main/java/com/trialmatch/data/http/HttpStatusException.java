package com.trialmatch.data.http;

import java.io.IOException;

/**
 * Non-2xx HTTP response. Keeps the status so callers can tell a 404 apart from an outage.
 */
public class HttpStatusException extends IOException {
    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url, String body) {
        super("HTTP " + statusCode + " for " + url + (body == null || body.isBlank() ? "" : " body=" + abbreviate(body)));
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    private static String abbreviate(String body) {
        String trimmed = body.trim();
        return trimmed.length() <= 300 ? trimmed : trimmed.substring(0, 300) + "...";
    }
}
