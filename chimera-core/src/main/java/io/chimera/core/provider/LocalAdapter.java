package io.chimera.core.provider;

import io.chimera.core.context.ConversationContext;
import java.time.Duration;

/**
 * Local model server (Ollama, LM Studio, ...) reached through its OpenAI-compatible endpoint. With
 * no endpoint configured it answers with a fixed placeholder and never touches the network.
 */
public final class LocalAdapter implements ProviderAdapter {
    private final ProviderAdapter endpoint;

    private LocalAdapter(ProviderAdapter endpoint) {
        this.endpoint = endpoint;
    }

    public static LocalAdapter placeholder() {
        return new LocalAdapter(null);
    }

    public static LocalAdapter forEndpoint(String apiBase, Duration timeout) {
        if (apiBase == null || apiBase.isBlank()) {
            return placeholder();
        }
        return new LocalAdapter(new OpenAiCompatAdapter(ProviderTag.LOCAL, apiBase, CredentialSource.none(), timeout, false));
    }

    public boolean hasEndpoint() {
        return endpoint != null;
    }

    @Override
    public ProviderTag provider() {
        return ProviderTag.LOCAL;
    }

    @Override
    public ProviderResponse call(String model, ConversationContext context, String credential) {
        if (endpoint == null) {
            return ProviderResponse.success(
                ProviderFailures.label(ProviderTag.LOCAL, model)
                    + " This is a placeholder response. Configure a local model endpoint to serve real completions.",
                model,
                ProviderTag.LOCAL,
                0
            );
        }
        return endpoint.call(model, context, credential);
    }
}
