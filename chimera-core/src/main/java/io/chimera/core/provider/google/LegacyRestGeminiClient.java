package io.chimera.core.provider.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.provider.ProviderHttp;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Older-generation request shape: the whole context is flattened into one user prompt and posted
 * to {@code generateContent} over plain HTTP.
 */
final class LegacyRestGeminiClient implements GeminiClient {
    static final String CLIENT_CLASS = "okhttp3.OkHttpClient";
    static final String HISTORY_HEADER = "=== Conversation History ===";

    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    LegacyRestGeminiClient(String apiBase, Duration timeout) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.client = ProviderHttp.client(timeout);
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "rest-legacy";
    }

    @Override
    public GeminiReply generate(String model, ConversationContext context, String apiKey) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", List.of(Map.of(
            "role", "user",
            "parts", List.of(Map.of("text", flatten(context)))
        )));
        payload.put("generationConfig", Map.of("temperature", 0.7, "maxOutputTokens", 2000));

        Request request = new Request.Builder()
            .url(generateUrl(model))
            .post(RequestBody.create(mapper.writeValueAsString(payload), ProviderHttp.JSON))
            .header("x-goog-api-key", apiKey)
            .header("Content-Type", "application/json")
            .build();

        try (Response response = client.newCall(request).execute()) {
            return parse(model, ProviderHttp.successBody(response));
        }
    }

    static String flatten(ConversationContext context) {
        String system = context.systemContent();
        if (system.isBlank() && context.history().isEmpty()) {
            return context.userMessage();
        }

        StringBuilder prompt = new StringBuilder(system);
        if (!context.history().isEmpty()) {
            prompt.append("\n\n").append(HISTORY_HEADER).append('\n');
            for (ChatMessage message : context.history()) {
                prompt.append(message.role().wireName()).append(": ").append(message.content()).append('\n');
            }
        }
        prompt.append(ConversationContext.USER_TURN_DELIMITER).append(context.userMessage());
        return prompt.toString();
    }

    private HttpUrl generateUrl(String model) {
        return apiBase.newBuilder()
            .addPathSegment("v1beta")
            .addPathSegment("models")
            .addPathSegment(model + ":generateContent")
            .build();
    }

    private GeminiReply parse(String model, String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode candidate = root.path("candidates").path(0);

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }

        boolean blocked = !root.path("promptFeedback").path("blockReason").asText("").isEmpty()
            || "SAFETY".equals(candidate.path("finishReason").asText(""));
        return new GeminiReply(
            text.toString(),
            root.path("modelVersion").asText(model),
            root.path("usageMetadata").path("totalTokenCount").asInt(0),
            blocked
        );
    }
}
