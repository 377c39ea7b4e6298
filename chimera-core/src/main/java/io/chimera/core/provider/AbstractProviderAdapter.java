package io.chimera.core.provider;

import io.chimera.core.context.ConversationContext;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credential resolution and failure mapping common to every remote provider. Subclasses only
 * translate the context into a request and the answer into a {@link ProviderResponse}.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ProviderTag provider;
    private final CredentialSource credentials;

    protected AbstractProviderAdapter(ProviderTag provider, CredentialSource credentials) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
    }

    @Override
    public final ProviderTag provider() {
        return provider;
    }

    @Override
    public final ProviderResponse call(String model, ConversationContext context, String credential) {
        String apiKey = credentials.resolve(credential);
        if (requiresCredential() && apiKey.isBlank()) {
            log.warn("No API key for provider {} (model {})", provider, model);
            return ProviderFailures.missingCredential(provider, model);
        }

        try {
            return invoke(model, context, apiKey);
        } catch (IOException | RuntimeException e) {
            log.warn("Provider {} call failed for model {}: {}", provider, model, e.getMessage());
            log.debug("Provider {} failure detail", provider, e);
            return ProviderFailures.classify(provider, model, e);
        } catch (LinkageError e) {
            log.warn("Client library for provider {} is unusable: {}", provider, e.toString());
            return ProviderFailures.unsupportedCapability(provider, model, "client library not available: " + e.getMessage());
        }
    }

    protected boolean requiresCredential() {
        return true;
    }

    protected abstract ProviderResponse invoke(String model, ConversationContext context, String apiKey)
        throws IOException;
}
