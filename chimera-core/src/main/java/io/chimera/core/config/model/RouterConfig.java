package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chimera.core.provider.IdentifierNormalizer;
import java.util.Map;

/**
 * @param models extra registry entries, model identifier to provider tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RouterConfig(
    @JsonAlias({"identifier_prefix"}) String identifierPrefix,
    Map<String, String> models
) {

    public RouterConfig {
        models = models == null ? Map.of() : Map.copyOf(models);
    }

    public static RouterConfig defaults() {
        return new RouterConfig(IdentifierNormalizer.DEFAULT_PREFIX, Map.of());
    }
}
