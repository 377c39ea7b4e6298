package io.chimera.core.provider.google;

import io.chimera.core.context.ConversationContext;
import io.chimera.core.provider.AbstractProviderAdapter;
import io.chimera.core.provider.CredentialSource;
import io.chimera.core.provider.ProviderFailures;
import io.chimera.core.provider.ProviderResponse;
import io.chimera.core.provider.ProviderTag;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gemini adapter. Gemini has no system role, so system content is folded into the first user turn.
 */
public final class GoogleAdapter extends AbstractProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(GoogleAdapter.class);

    private final Optional<GeminiClient> client;

    public GoogleAdapter(String apiBase, CredentialSource credentials, Duration timeout) {
        this(credentials, GeminiClients.select(apiBase, timeout));
    }

    public GoogleAdapter(CredentialSource credentials, Optional<GeminiClient> client) {
        super(ProviderTag.GOOGLE, credentials);
        this.client = client == null ? Optional.empty() : client;
    }

    public Optional<String> clientName() {
        return client.map(GeminiClient::name);
    }

    @Override
    protected ProviderResponse invoke(String model, ConversationContext context, String apiKey) throws IOException {
        if (client.isEmpty()) {
            return ProviderFailures.unsupportedCapability(
                provider(),
                model,
                "Neither the Google GenAI client nor the legacy REST client is available"
            );
        }

        String upstreamModel = GeminiModels.upstreamName(model);
        LOG.info("Google call: requested model={}, using={}, client={}", model, upstreamModel, client.get().name());
        GeminiReply reply = client.get().generate(upstreamModel, context, apiKey);

        String servedModel = reply.servedModel() == null || reply.servedModel().isBlank()
            ? upstreamModel
            : reply.servedModel();
        if (!reply.text().isBlank()) {
            return ProviderResponse.success(reply.text(), servedModel, provider(), reply.totalTokens());
        }
        if (reply.blocked()) {
            return ProviderFailures.contentBlocked(provider(), servedModel);
        }
        return ProviderFailures.emptyResponse(provider(), servedModel);
    }
}
