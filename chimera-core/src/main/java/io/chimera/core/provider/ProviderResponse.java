package io.chimera.core.provider;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform result of every provider call. Failures are reported through {@link #status()} and
 * {@link #errorKind()}, never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderResponse(
    String reply,
    String model,
    ProviderTag provider,
    int tokens,
    ResponseStatus status,
    String error,
    ProviderErrorKind errorKind,
    Map<String, Object> metadata
) {
    public ProviderResponse {
        reply = reply == null ? "" : reply;
        model = model == null ? "" : model;
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(status, "status must not be null");
        tokens = Math.max(0, tokens);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ProviderResponse success(String reply, String model, ProviderTag provider, int tokens) {
        return success(reply, model, provider, tokens, Map.of());
    }

    public static ProviderResponse success(
        String reply,
        String model,
        ProviderTag provider,
        int tokens,
        Map<String, Object> metadata
    ) {
        return new ProviderResponse(reply, model, provider, tokens, ResponseStatus.SUCCESS, null, null, metadata);
    }

    public static ProviderResponse failure(
        ProviderErrorKind kind,
        String reply,
        String model,
        ProviderTag provider,
        String error
    ) {
        Objects.requireNonNull(kind, "kind must not be null");
        return new ProviderResponse(reply, model, provider, 0, ResponseStatus.ERROR, error, kind, Map.of());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }
}
