package io.chimera.core.provider;

import java.util.Objects;

/**
 * Reconciles free-form model names against a {@link ModelRegistry}. Unknown names resolve to
 * {@link ProviderTag#ECHO} instead of failing.
 */
public final class IdentifierNormalizer {
    public static final String DEFAULT_PREFIX = "model-";

    private final ModelRegistry registry;
    private final String prefix;

    public IdentifierNormalizer(ModelRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    public IdentifierNormalizer(ModelRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.prefix = prefix == null ? "" : prefix;
    }

    public ModelRegistry registry() {
        return registry;
    }

    public String stripPrefix(String identifier) {
        String value = identifier == null ? "" : identifier.trim();
        if (prefix.isEmpty()) {
            return value;
        }
        while (value.startsWith(prefix)) {
            value = value.substring(prefix.length()).trim();
        }
        return value;
    }

    public String normalize(String identifier) {
        String stripped = stripPrefix(identifier);
        return registry.canonicalKey(stripped).orElse(stripped);
    }

    public ProviderTag resolveProvider(String identifier) {
        return registry.lookup(stripPrefix(identifier)).orElse(ProviderTag.ECHO);
    }

    public ModelIdentifier resolve(String identifier) {
        String stripped = stripPrefix(identifier);
        return registry.canonicalKey(stripped)
            .map(key -> new ModelIdentifier(identifier, key, registry.lookup(key).orElse(ProviderTag.ECHO)))
            .orElseGet(() -> new ModelIdentifier(identifier, stripped, ProviderTag.ECHO));
    }

    public boolean isSupported(String identifier) {
        String stripped = stripPrefix(identifier);
        return registry.canonicalKey(stripped).isPresent() || registry.hasPrefixMatch(stripped);
    }
}
