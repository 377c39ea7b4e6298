package io.chimera.core.provider;

import java.io.IOException;

/**
 * Non-2xx answer from a provider API, or a structured API error raised by a provider client.
 */
public final class ProviderHttpException extends IOException {
    private final int statusCode;
    private final String body;

    public ProviderHttpException(int statusCode, String body) {
        super("HTTP " + statusCode + (body == null || body.isBlank() ? "" : " " + body));
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
