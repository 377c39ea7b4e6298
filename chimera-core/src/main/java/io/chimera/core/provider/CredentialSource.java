package io.chimera.core.provider;

import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the API key for a call: the explicit credential when present, otherwise the named
 * environment variable. Nothing is cached.
 */
public record CredentialSource(String variable, Function<String, String> environment) {

    public CredentialSource {
        variable = variable == null ? "" : variable;
        Objects.requireNonNull(environment, "environment must not be null");
    }

    public static CredentialSource none() {
        return new CredentialSource("", name -> null);
    }

    public String resolve(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        if (variable.isBlank()) {
            return "";
        }
        String fromEnvironment = environment.apply(variable);
        return fromEnvironment == null ? "" : fromEnvironment.trim();
    }
}
