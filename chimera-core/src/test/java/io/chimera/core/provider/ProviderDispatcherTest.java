package io.chimera.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.context.ContextBuilder;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.conversation.ConversationMessage;
import io.chimera.core.conversation.ConversationSnapshot;
import io.chimera.core.conversation.InjectedMemory;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderDispatcherTest {
    private static final Instant BASE = Instant.parse("2025-03-01T08:00:00Z");

    @Test
    void shouldReportMissingKeyForKnownModel() {
        ProviderDispatcher dispatcher = ProviderDispatcher.fromConfig(ChimeraConfig.defaults(), name -> null);

        ProviderResponse response = dispatcher.complete("gpt-4", "Hello", null);

        assertThat(response.status()).isEqualTo(ResponseStatus.ERROR);
        assertThat(response.provider()).isEqualTo(ProviderTag.OPENAI);
        assertThat(response.errorKind()).isEqualTo(ProviderErrorKind.MISSING_CREDENTIAL);
        assertThat(response.reply()).contains("No API key");
    }

    @Test
    void shouldEchoUnknownModelAfterStrippingPrefix() {
        ProviderDispatcher dispatcher = ProviderDispatcher.fromConfig(ChimeraConfig.defaults(), name -> null);

        ProviderResponse response = dispatcher.complete("model-unknown-model-xyz", "ping", null);

        assertThat(response.status()).isEqualTo(ResponseStatus.SUCCESS);
        assertThat(response.provider()).isEqualTo(ProviderTag.ECHO);
        assertThat(response.model()).isEqualTo("unknown-model-xyz");
        assertThat(response.reply()).contains("ping");
    }

    @Test
    void shouldPassRecentHistoryAndActiveMemoriesToAdapter() {
        CapturingAdapter openai = new CapturingAdapter(ProviderTag.OPENAI);
        ProviderDispatcher dispatcher = dispatcher(openai);

        List<ConversationMessage> messages = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            messages.add(new ConversationMessage(
                i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT,
                "turn " + i,
                BASE.plusSeconds(i)
            ));
        }
        ConversationSnapshot conversation = new ConversationSnapshot(
            "model-GPT-4",
            messages,
            List.of(
                InjectedMemory.of("A", "alpha", true),
                InjectedMemory.of("B", "beta", true),
                InjectedMemory.of("C", "gamma", false)
            )
        );

        ProviderResponse response = dispatcher.complete(conversation, "next question", "sk-conversation");

        assertThat(response.isSuccess()).isTrue();
        assertThat(openai.model).isEqualTo("gpt-4");
        assertThat(openai.credential).isEqualTo("sk-conversation");

        ConversationContext context = openai.context;
        assertThat(context.history()).hasSize(ContextBuilder.HISTORY_LIMIT);
        assertThat(context.history().get(0).content()).isEqualTo("turn 4");
        assertThat(context.history().get(9).content()).isEqualTo("turn 13");
        assertThat(context.userMessage()).isEqualTo("next question");
        assertThat(context.memoryBlock()).contains("[A]", "[B]").doesNotContain("[C]");

        List<ChatMessage> wire = context.messages();
        assertThat(wire.get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(wire.get(wire.size() - 1)).isEqualTo(ChatMessage.user("next question"));
    }

    @Test
    void shouldFallBackToEchoWhenProviderHasNoAdapter() {
        ProviderDispatcher dispatcher = dispatcher(new CapturingAdapter(ProviderTag.OPENAI));

        ProviderResponse response = dispatcher.complete("claude-3-opus", "hi", null);

        assertThat(response.provider()).isEqualTo(ProviderTag.ECHO);
        assertThat(response.model()).isEqualTo("claude-3-opus");
        assertThat(response.isSuccess()).isTrue();
    }

    @Test
    void shouldTurnAdapterExceptionIntoErrorEnvelope() {
        ProviderAdapter failing = new ProviderAdapter() {
            @Override
            public ProviderTag provider() {
                return ProviderTag.DEEPSEEK;
            }

            @Override
            public ProviderResponse call(String model, ConversationContext context, String credential) {
                throw new IllegalStateException("connection reset");
            }
        };

        ProviderResponse response = dispatcher(failing).complete("deepseek-chat", "hi", null);

        assertThat(response.status()).isEqualTo(ResponseStatus.ERROR);
        assertThat(response.provider()).isEqualTo(ProviderTag.DEEPSEEK);
        assertThat(response.errorKind()).isEqualTo(ProviderErrorKind.GENERIC_PROVIDER_FAILURE);
        assertThat(response.reply()).isEqualTo("[DeepSeek deepseek-chat] Error: connection reset");
    }

    @Test
    void shouldListModelsGroupedByProviderTag() {
        ProviderDispatcher dispatcher = ProviderDispatcher.fromConfig(ChimeraConfig.defaults(), name -> null);

        Map<String, List<String>> models = dispatcher.listSupportedModels();

        assertThat(models).containsKeys("openai", "anthropic", "google", "deepseek", "groq", "echo", "local");
        assertThat(models.get("openai")).containsExactly("gpt-4", "gpt-4-turbo", "gpt-4o", "gpt-3.5-turbo");
        assertThat(models.get("echo")).containsExactly("echo");
    }

    @Test
    void shouldAnswerSupportQueries() {
        ProviderDispatcher dispatcher = ProviderDispatcher.fromConfig(ChimeraConfig.defaults(), name -> null);

        assertThat(dispatcher.isModelSupported("model-gemini-1.5-pro")).isTrue();
        assertThat(dispatcher.isModelSupported("gemini-15-pro")).isTrue();
        assertThat(dispatcher.isModelSupported("mistral-large")).isFalse();
        assertThat(dispatcher.resolve("gpt4o").provider()).isEqualTo(ProviderTag.OPENAI);
    }

    private static ProviderDispatcher dispatcher(ProviderAdapter... adapters) {
        return new ProviderDispatcher(
            new IdentifierNormalizer(ModelRegistry.defaults()),
            new ContextBuilder(),
            List.of(adapters)
        );
    }

    private static final class CapturingAdapter implements ProviderAdapter {
        private final ProviderTag provider;
        private String model;
        private ConversationContext context;
        private String credential;

        private CapturingAdapter(ProviderTag provider) {
            this.provider = provider;
        }

        @Override
        public ProviderTag provider() {
            return provider;
        }

        @Override
        public ProviderResponse call(String model, ConversationContext context, String credential) {
            this.model = model;
            this.context = context;
            this.credential = credential;
            return ProviderResponse.success("captured", model, provider, 1);
        }
    }
}
