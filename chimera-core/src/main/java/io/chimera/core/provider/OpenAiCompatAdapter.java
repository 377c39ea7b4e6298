package io.chimera.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.model.ChatMessage;
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

/**
 * Chat completions client for OpenAI and the APIs that mirror it (DeepSeek, Groq, local
 * OpenAI-compatible servers).
 */
public final class OpenAiCompatAdapter extends AbstractProviderAdapter {
    static final double TEMPERATURE = 0.7;
    static final int MAX_TOKENS = 2000;

    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final boolean credentialRequired;

    public OpenAiCompatAdapter(ProviderTag provider, String apiBase, CredentialSource credentials, Duration timeout) {
        this(provider, apiBase, credentials, timeout, true);
    }

    public OpenAiCompatAdapter(
        ProviderTag provider,
        String apiBase,
        CredentialSource credentials,
        Duration timeout,
        boolean credentialRequired
    ) {
        super(provider, credentials);
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.client = ProviderHttp.client(timeout);
        this.mapper = new ObjectMapper();
        this.credentialRequired = credentialRequired;
    }

    @Override
    protected boolean requiresCredential() {
        return credentialRequired;
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
        payload.put("messages", toWireMessages(context.messages()));
        payload.put("temperature", TEMPERATURE);
        payload.put("max_tokens", MAX_TOKENS);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), ProviderHttp.JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireName());
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private ProviderResponse parseResponse(String model, String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode choice = root.path("choices").path(0);
        String content = choice.path("message").path("content").asText("");
        String servedModel = root.path("model").asText(model);

        if (content.isBlank()) {
            if ("content_filter".equals(choice.path("finish_reason").asText(""))) {
                return ProviderFailures.contentBlocked(provider(), servedModel);
            }
            return ProviderFailures.emptyResponse(provider(), servedModel);
        }
        int tokens = root.path("usage").path("total_tokens").asInt(0);
        return ProviderResponse.success(content, servedModel, provider(), tokens);
    }
}
