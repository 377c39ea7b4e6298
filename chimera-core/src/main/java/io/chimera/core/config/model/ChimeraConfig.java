package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChimeraConfig(
    RouterConfig router,
    ProvidersConfig providers
) {

    public static ChimeraConfig defaults() {
        return new ChimeraConfig(
            RouterConfig.defaults(),
            ProvidersConfig.defaults()
        );
    }
}
