package io.chimera.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class AnthropicAdapter extends AbstractProviderAdapter {
    static final String API_VERSION = "2023-06-01";
    static final int MAX_TOKENS = 2000;

    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public AnthropicAdapter(String apiBase, CredentialSource credentials, Duration timeout) {
        super(ProviderTag.ANTHROPIC, credentials);
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.client = ProviderHttp.client(timeout);
        this.mapper = new ObjectMapper();
    }

    @Override
    protected ProviderResponse invoke(String model, ConversationContext context, String apiKey) throws IOException {
        Request request = buildRequest(model, context, apiKey);
        try (Response response = client.newCall(request).execute()) {
            return parseResponse(model, ProviderHttp.successBody(response));
        }
    }

    private Request buildRequest(String model, ConversationContext context, String apiKey) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", MAX_TOKENS);

        String systemPrompt = context.systemContent();
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        payload.put("messages", toWireMessages(context.messages()));

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), ProviderHttp.JSON);
        return new Request.Builder()
            .url(messagesUrl())
            .post(body)
            .header("x-api-key", apiKey)
            .header("anthropic-version", API_VERSION)
            .header("content-type", "application/json")
            .build();
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    // system content travels in the top-level "system" field
    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private ProviderResponse parseResponse(String model, String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        StringBuilder content = new StringBuilder();
        for (JsonNode item : root.path("content")) {
            if ("text".equals(item.path("type").asText(""))) {
                content.append(item.path("text").asText(""));
            }
        }

        String servedModel = root.path("model").asText(model);
        if (content.length() == 0) {
            if ("refusal".equals(root.path("stop_reason").asText(""))) {
                return ProviderFailures.contentBlocked(provider(), servedModel);
            }
            return ProviderFailures.emptyResponse(provider(), servedModel);
        }

        JsonNode usage = root.path("usage");
        int tokens = usage.path("input_tokens").asInt(0) + usage.path("output_tokens").asInt(0);
        return ProviderResponse.success(content.toString(), servedModel, provider(), tokens);
    }
}
