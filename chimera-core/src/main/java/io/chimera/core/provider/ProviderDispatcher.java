package io.chimera.core.provider;

import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.context.ContextBuilder;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.conversation.Conversation;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the router: resolves the model identifier, builds the turn context and hands it
 * to the matching adapter. Holds no per-call state, so one instance serves concurrent callers.
 */
public final class ProviderDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderDispatcher.class);

    private final IdentifierNormalizer identifiers;
    private final ContextBuilder contextBuilder;
    private final Map<ProviderTag, ProviderAdapter> adapters;
    private final ProviderAdapter echo;

    public ProviderDispatcher(
        IdentifierNormalizer identifiers,
        ContextBuilder contextBuilder,
        Collection<? extends ProviderAdapter> adapters
    ) {
        this.identifiers = Objects.requireNonNull(identifiers, "identifiers must not be null");
        this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder must not be null");

        Map<ProviderTag, ProviderAdapter> byProvider = new EnumMap<>(ProviderTag.class);
        for (ProviderAdapter adapter : adapters) {
            byProvider.put(adapter.provider(), adapter);
        }
        this.echo = byProvider.computeIfAbsent(ProviderTag.ECHO, ignored -> new EchoAdapter());
        this.adapters = Collections.unmodifiableMap(byProvider);
    }

    public static ProviderDispatcher fromConfig(ChimeraConfig config, Function<String, String> environment) {
        return new ProviderDispatcher(
            ProviderAdapters.normalizer(config),
            new ContextBuilder(),
            ProviderAdapters.fromConfig(config, environment)
        );
    }

    /**
     * Answers {@code userMessage} within a stored conversation, using the conversation's model and
     * its active injected memories and recent history.
     *
     * @param credential decrypted key for the conversation's provider, or {@code null} to fall back
     *     to the provider's environment variable
     */
    public ProviderResponse complete(Conversation conversation, String userMessage, String credential) {
        Objects.requireNonNull(conversation, "conversation must not be null");
        ModelIdentifier identifier = identifiers.resolve(conversation.modelId());
        ConversationContext context = contextBuilder.build(conversation, userMessage);
        return dispatch(identifier, context, credential);
    }

    /**
     * Direct invocation without a backing conversation. Credentials come from the environment only.
     *
     * @param context optional context text placed ahead of the prompt, may be {@code null}
     */
    public ProviderResponse complete(String modelName, String prompt, String context) {
        ModelIdentifier identifier = identifiers.resolve(modelName);
        return dispatch(identifier, ConversationContext.forPrompt(prompt, context), null);
    }

    public boolean isModelSupported(String identifier) {
        return identifiers.isSupported(identifier);
    }

    public Map<String, List<String>> listSupportedModels() {
        Map<String, List<String>> models = new LinkedHashMap<>();
        identifiers.registry().modelsByProvider().forEach((provider, names) -> models.put(provider.tag(), names));
        return Collections.unmodifiableMap(models);
    }

    public ModelIdentifier resolve(String identifier) {
        return identifiers.resolve(identifier);
    }

    private ProviderResponse dispatch(ModelIdentifier identifier, ConversationContext context, String credential) {
        ProviderAdapter adapter = adapters.get(identifier.provider());
        if (adapter == null) {
            LOG.warn("No adapter registered for provider {}, falling back to echo", identifier.provider());
            adapter = echo;
        } else if (identifiers.registry().lookup(identifier.normalized()).isEmpty()) {
            LOG.warn("No registry match for model_id={}, falling back to echo", identifier.raw());
        }

        LOG.info(
            "Dispatching model_id={} provider={} model={} has_credential={}",
            identifier.raw(),
            adapter.provider(),
            identifier.normalized(),
            credential != null && !credential.isBlank()
        );

        try {
            ProviderResponse response = adapter.call(identifier.normalized(), context, credential);
            LOG.debug("Provider {} answered with status {} ({} tokens)", response.provider(), response.status(), response.tokens());
            return response;
        } catch (RuntimeException e) {
            LOG.error("Adapter {} raised instead of returning an envelope", adapter.provider(), e);
            return ProviderFailures.classify(adapter.provider(), identifier.normalized(), e);
        }
    }
}
