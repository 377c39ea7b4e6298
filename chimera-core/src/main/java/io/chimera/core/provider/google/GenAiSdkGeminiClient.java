package io.chimera.core.provider.google;

import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import io.chimera.core.provider.ProviderHttp;
import io.chimera.core.provider.ProviderHttpException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-turn calls through the Google GenAI Java client. Only loaded when that client is on the
 * classpath. A client is opened per call because the key may differ between calls.
 */
final class GenAiSdkGeminiClient implements GeminiClient {
    static final String CLIENT_CLASS = "com.google.genai.Client";

    private final Duration timeout;

    GenAiSdkGeminiClient(Duration timeout) {
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative()
            ? ProviderHttp.DEFAULT_TIMEOUT
            : timeout;
    }

    @Override
    public String name() {
        return "google-genai";
    }

    Duration timeout() {
        return timeout;
    }

    @Override
    public GeminiReply generate(String model, ConversationContext context, String apiKey) throws IOException {
        GenerateContentConfig config = GenerateContentConfig.builder()
            .temperature(0.7f)
            .maxOutputTokens(2000)
            .build();

        try (Client client = Client.builder()
            .apiKey(apiKey)
            .httpOptions(HttpOptions.builder().timeout((int) timeout.toMillis()).build())
            .build()) {
            return toReply(client.models.generateContent(model, toContents(context), config), model);
        } catch (ApiException e) {
            throw toHttpException(e);
        }
    }

    static List<Content> toContents(ConversationContext context) {
        List<Content> contents = new ArrayList<>();
        for (ChatMessage message : context.messagesWithSystemFolded()) {
            contents.add(Content.builder()
                .role(message.role() == MessageRole.USER ? "user" : "model")
                .parts(List.of(Part.fromText(message.content())))
                .build());
        }
        return contents;
    }

    static GeminiReply toReply(GenerateContentResponse response, String model) {
        int tokens = response.usageMetadata()
            .flatMap(usage -> usage.totalTokenCount())
            .orElse(0);
        return new GeminiReply(response.text(), model, tokens, response.promptFeedback().isPresent());
    }

    static ProviderHttpException toHttpException(ApiException failure) {
        return new ProviderHttpException(failure.code(), failure.getMessage());
    }
}
