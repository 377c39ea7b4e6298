package io.chimera.core.provider;

import java.util.Objects;

/**
 * A caller supplied model name together with its registry form and the provider it routes to.
 */
public record ModelIdentifier(String raw, String normalized, ProviderTag provider) {

    public ModelIdentifier {
        raw = raw == null ? "" : raw;
        normalized = normalized == null ? "" : normalized;
        Objects.requireNonNull(provider, "provider must not be null");
    }
}
