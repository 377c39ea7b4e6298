package io.chimera.core.provider.google;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.genai.errors.ApiException;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.GenerateContentResponsePromptFeedback;
import com.google.genai.types.GenerateContentResponseUsageMetadata;
import com.google.genai.types.Part;
import io.chimera.core.context.ConversationContext;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.provider.ProviderHttp;
import io.chimera.core.provider.ProviderHttpException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class GenAiSdkGeminiClientTest {

    @Test
    void shouldMapRolesAndFoldSystemContent() {
        ConversationContext context = new ConversationContext(
            "sys",
            "",
            List.of(ChatMessage.system("stored"), ChatMessage.assistant("greeting"), ChatMessage.user("earlier")),
            "now"
        );

        List<Content> contents = GenAiSdkGeminiClient.toContents(context);

        assertThat(contents).extracting(content -> content.role().orElse(""))
            .containsExactly("model", "user", "user");
        assertThat(text(contents.get(1))).isEqualTo("sys\n\nUser: earlier");
        assertThat(text(contents.get(2))).isEqualTo("now");
    }

    @Test
    void shouldFoldIntoCurrentTurnWithoutHistory() {
        ConversationContext context = new ConversationContext("sys", "", List.of(), "hi");

        List<Content> contents = GenAiSdkGeminiClient.toContents(context);

        assertThat(contents).hasSize(1);
        assertThat(text(contents.get(0))).isEqualTo("sys\n\nUser: hi");
    }

    @Test
    void shouldReadTextAndTokenUsage() {
        GenerateContentResponse response = GenerateContentResponse.builder()
            .candidates(List.of(Candidate.builder()
                .content(Content.builder()
                    .role("model")
                    .parts(List.of(Part.fromText("answer")))
                    .build())
                .build()))
            .usageMetadata(GenerateContentResponseUsageMetadata.builder().totalTokenCount(21).build())
            .build();

        GeminiReply reply = GenAiSdkGeminiClient.toReply(response, "gemini-2.0-flash");

        assertThat(reply.text()).isEqualTo("answer");
        assertThat(reply.totalTokens()).isEqualTo(21);
        assertThat(reply.servedModel()).isEqualTo("gemini-2.0-flash");
        assertThat(reply.blocked()).isFalse();
    }

    @Test
    void shouldFlagPromptFeedbackAsBlocked() {
        GenerateContentResponse response = GenerateContentResponse.builder()
            .promptFeedback(GenerateContentResponsePromptFeedback.builder().build())
            .build();

        GeminiReply reply = GenAiSdkGeminiClient.toReply(response, "gemini-1.5-pro");

        assertThat(reply.blocked()).isTrue();
        assertThat(reply.text()).isEmpty();
        assertThat(reply.totalTokens()).isZero();
    }

    @Test
    void shouldCarryApiStatusCode() {
        ProviderHttpException failure = GenAiSdkGeminiClient.toHttpException(
            new ApiException(429, "RESOURCE_EXHAUSTED", "Quota exceeded")
        );

        assertThat(failure.statusCode()).isEqualTo(429);
        assertThat(failure.getMessage()).startsWith("HTTP 429");
    }

    @Test
    void shouldApplyConfiguredTimeout() {
        assertThat(new GenAiSdkGeminiClient(Duration.ofSeconds(15)).timeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(new GenAiSdkGeminiClient(null).timeout()).isEqualTo(ProviderHttp.DEFAULT_TIMEOUT);
    }

    private static String text(Content content) {
        return content.parts().orElseThrow().get(0).text().orElse("");
    }
}
