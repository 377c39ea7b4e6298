package io.chimera.core.provider;

import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.config.model.ProviderConfig;
import io.chimera.core.config.model.ProvidersConfig;
import io.chimera.core.config.model.RouterConfig;
import io.chimera.core.provider.google.GoogleAdapter;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the registry and the adapter set described by a {@link ChimeraConfig}.
 */
public final class ProviderAdapters {

    private ProviderAdapters() {
    }

    public static IdentifierNormalizer normalizer(ChimeraConfig config) {
        RouterConfig router = config.router() == null ? RouterConfig.defaults() : config.router();
        return new IdentifierNormalizer(registry(router), router.identifierPrefix());
    }

    public static ModelRegistry registry(RouterConfig router) {
        ModelRegistry.Builder builder = ModelRegistry.builder().withDefaults();
        for (Map.Entry<String, String> entry : router.models().entrySet()) {
            ProviderTag provider = ProviderTag.fromTag(entry.getValue())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown provider '" + entry.getValue() + "' for model " + entry.getKey()
                ));
            builder.register(entry.getKey(), provider);
        }
        return builder.build();
    }

    public static List<ProviderAdapter> fromConfig(ChimeraConfig config, Function<String, String> environment) {
        ProvidersConfig providers = config.providers() == null ? ProvidersConfig.defaults() : config.providers();

        ProviderConfig openai = providers.forProvider(ProviderTag.OPENAI);
        ProviderConfig anthropic = providers.forProvider(ProviderTag.ANTHROPIC);
        ProviderConfig google = providers.forProvider(ProviderTag.GOOGLE);
        ProviderConfig deepseek = providers.forProvider(ProviderTag.DEEPSEEK);
        ProviderConfig groq = providers.forProvider(ProviderTag.GROQ);
        ProviderConfig local = providers.forProvider(ProviderTag.LOCAL);

        return List.of(
            new OpenAiCompatAdapter(
                ProviderTag.OPENAI,
                openai.baseOr(ProvidersConfig.OPENAI_BASE),
                credentials(ProviderTag.OPENAI, openai, environment),
                openai.timeout()
            ),
            new AnthropicAdapter(
                anthropic.baseOr(ProvidersConfig.ANTHROPIC_BASE),
                credentials(ProviderTag.ANTHROPIC, anthropic, environment),
                anthropic.timeout()
            ),
            new GoogleAdapter(
                google.baseOr(ProvidersConfig.GOOGLE_BASE),
                credentials(ProviderTag.GOOGLE, google, environment),
                google.timeout()
            ),
            new OpenAiCompatAdapter(
                ProviderTag.DEEPSEEK,
                deepseek.baseOr(ProvidersConfig.DEEPSEEK_BASE),
                credentials(ProviderTag.DEEPSEEK, deepseek, environment),
                deepseek.timeout()
            ),
            new OpenAiCompatAdapter(
                ProviderTag.GROQ,
                groq.baseOr(ProvidersConfig.GROQ_BASE),
                credentials(ProviderTag.GROQ, groq, environment),
                groq.timeout()
            ),
            LocalAdapter.forEndpoint(local.apiBase(), local.timeout()),
            new EchoAdapter()
        );
    }

    static CredentialSource credentials(
        ProviderTag provider,
        ProviderConfig config,
        Function<String, String> environment
    ) {
        return new CredentialSource(config.credentialEnvOr(provider.credentialEnv()), environment);
    }
}
