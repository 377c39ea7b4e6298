package io.chimera.core.provider;

import io.chimera.core.context.ConversationContext;

public interface ProviderAdapter {
    ProviderTag provider();

    /**
     * Sends one turn to the provider. Implementations never throw; every failure is reported as an
     * error {@link ProviderResponse}.
     *
     * @param model normalized model name, passed through to the remote API
     * @param context assembled prompt for this turn
     * @param credential decrypted API key, or {@code null} to use the environment fallback
     */
    ProviderResponse call(String model, ConversationContext context, String credential);
}
