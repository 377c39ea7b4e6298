package io.chimera.core.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of known model identifiers and the provider serving each of them.
 * Instances are safe to share between threads.
 */
public final class ModelRegistry {
    private final Map<String, ProviderTag> models;
    private final Map<String, String> aliases;

    private ModelRegistry(Map<String, ProviderTag> models, Map<String, String> aliases) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.aliases = Map.copyOf(aliases);
    }

    public static ModelRegistry defaults() {
        return builder().withDefaults().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry key for {@code name}: exact match first, then a case-insensitive match in
     * registration order, then a legacy alias.
     */
    public Optional<String> canonicalKey(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        if (models.containsKey(name)) {
            return Optional.of(name);
        }
        for (String key : models.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return Optional.of(key);
            }
        }
        return Optional.ofNullable(aliases.get(name.toLowerCase(Locale.ROOT)));
    }

    public Optional<ProviderTag> lookup(String name) {
        return canonicalKey(name).map(models::get);
    }

    public boolean hasPrefixMatch(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String key : models.keySet()) {
            if (lower.startsWith(key.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    public Set<String> identifiers() {
        return models.keySet();
    }

    public Map<ProviderTag, List<String>> modelsByProvider() {
        Map<ProviderTag, List<String>> grouped = new EnumMap<>(ProviderTag.class);
        models.forEach((model, provider) -> grouped.computeIfAbsent(provider, ignored -> new ArrayList<>()).add(model));
        grouped.replaceAll((provider, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(grouped);
    }

    public static final class Builder {
        private final Map<String, ProviderTag> models = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder withDefaults() {
            register(ProviderTag.OPENAI, "gpt-4", "gpt-4-turbo", "gpt-4o", "gpt-3.5-turbo");
            register(ProviderTag.ANTHROPIC, "claude-3-opus", "claude-3-sonnet", "claude-3-haiku", "claude-3.5-sonnet");
            register(ProviderTag.GOOGLE, "gemini-2.0-flash", "gemini-2.0-flash-exp", "gemini-1.5-flash", "gemini-1.5-pro");
            register(ProviderTag.DEEPSEEK, "deepseek-chat", "deepseek-coder");
            register(
                ProviderTag.GROQ,
                "llama-3.3-70b-versatile",
                "llama-3.1-8b-instant",
                "llama3-70b-8192",
                "llama3-8b-8192",
                "mixtral-8x7b-32768",
                "gemma2-9b-it"
            );
            register(ProviderTag.ECHO, "echo");
            register(ProviderTag.LOCAL, "local");

            // identifiers stored by older clients without dots and dashes
            alias("gemini-20-flash", "gemini-2.0-flash");
            alias("gemini-15-flash", "gemini-1.5-flash");
            alias("gemini-15-pro", "gemini-1.5-pro");
            alias("gpt4o", "gpt-4o");
            alias("gpt4", "gpt-4");
            alias("gpt4-turbo", "gpt-4-turbo");
            alias("gpt35-turbo", "gpt-3.5-turbo");
            alias("claude3-opus", "claude-3-opus");
            alias("claude3-sonnet", "claude-3-sonnet");
            alias("claude3-haiku", "claude-3-haiku");
            alias("claude35-sonnet", "claude-3.5-sonnet");
            return this;
        }

        public Builder register(ProviderTag provider, String... identifiers) {
            for (String identifier : identifiers) {
                register(identifier, provider);
            }
            return this;
        }

        public Builder register(String identifier, ProviderTag provider) {
            Objects.requireNonNull(provider, "provider must not be null");
            if (identifier == null || identifier.isBlank()) {
                throw new IllegalArgumentException("model identifier must not be blank");
            }
            ProviderTag existing = models.putIfAbsent(identifier, provider);
            if (existing != null && existing != provider) {
                throw new IllegalArgumentException(
                    "Model " + identifier + " is already mapped to " + existing + ", cannot remap to " + provider
                );
            }
            return this;
        }

        public Builder alias(String legacyIdentifier, String canonical) {
            if (legacyIdentifier == null || legacyIdentifier.isBlank()) {
                throw new IllegalArgumentException("alias must not be blank");
            }
            aliases.put(legacyIdentifier.toLowerCase(Locale.ROOT), Objects.requireNonNull(canonical, "canonical must not be null"));
            return this;
        }

        public ModelRegistry build() {
            for (Map.Entry<String, String> alias : aliases.entrySet()) {
                if (!models.containsKey(alias.getValue())) {
                    throw new IllegalStateException(
                        "Alias " + alias.getKey() + " points to unregistered model " + alias.getValue()
                    );
                }
            }
            return new ModelRegistry(models, aliases);
        }
    }
}
