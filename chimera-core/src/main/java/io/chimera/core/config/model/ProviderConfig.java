package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"api_key_env"}) String apiKeyEnv,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 90;

    public static ProviderConfig defaults(String apiBase) {
        return new ProviderConfig(apiBase, "", DEFAULT_TIMEOUT_SECONDS);
    }

    @JsonIgnore
    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS);
    }

    public String baseOr(String fallback) {
        return apiBase == null || apiBase.isBlank() ? fallback : apiBase;
    }

    public String credentialEnvOr(String fallback) {
        return apiKeyEnv == null || apiKeyEnv.isBlank() ? fallback : apiKeyEnv;
    }
}
