package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chimera.core.provider.ProviderTag;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openai,
    ProviderConfig anthropic,
    ProviderConfig google,
    ProviderConfig deepseek,
    ProviderConfig groq,
    ProviderConfig local
) {
    public static final String OPENAI_BASE = "https://api.openai.com/v1";
    public static final String ANTHROPIC_BASE = "https://api.anthropic.com/v1";
    public static final String GOOGLE_BASE = "https://generativelanguage.googleapis.com";
    public static final String DEEPSEEK_BASE = "https://api.deepseek.com";
    public static final String GROQ_BASE = "https://api.groq.com/openai/v1";

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(OPENAI_BASE),
            ProviderConfig.defaults(ANTHROPIC_BASE),
            ProviderConfig.defaults(GOOGLE_BASE),
            ProviderConfig.defaults(DEEPSEEK_BASE),
            ProviderConfig.defaults(GROQ_BASE),
            ProviderConfig.defaults("")
        );
    }

    public ProviderConfig forProvider(ProviderTag provider) {
        ProviderConfig config = switch (provider) {
            case OPENAI -> openai;
            case ANTHROPIC -> anthropic;
            case GOOGLE -> google;
            case DEEPSEEK -> deepseek;
            case GROQ -> groq;
            case LOCAL -> local;
            case ECHO -> null;
        };
        return config == null ? ProviderConfig.defaults("") : config;
    }
}
