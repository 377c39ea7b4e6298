package io.chimera.core.provider;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum ProviderTag {
    OPENAI("openai", "OpenAI", "OPENAI_API_KEY"),
    ANTHROPIC("anthropic", "Anthropic", "ANTHROPIC_API_KEY"),
    GOOGLE("google", "Google", "GOOGLE_AI_API_KEY"),
    DEEPSEEK("deepseek", "DeepSeek", "DEEPSEEK_API_KEY"),
    GROQ("groq", "Groq", "GROQ_API_KEY"),
    LOCAL("local", "Local", ""),
    ECHO("echo", "Echo", "");

    private final String tag;
    private final String displayName;
    private final String credentialEnv;

    ProviderTag(String tag, String displayName, String credentialEnv) {
        this.tag = tag;
        this.displayName = displayName;
        this.credentialEnv = credentialEnv;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Environment variable holding the fallback credential, or an empty string when the provider
     * needs none.
     */
    public String credentialEnv() {
        return credentialEnv;
    }

    public static Optional<ProviderTag> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ProviderTag provider : values()) {
            if (provider.tag.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
