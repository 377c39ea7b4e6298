package io.chimera.core.context;

import static org.assertj.core.api.Assertions.assertThat;

import io.chimera.core.conversation.ConversationMessage;
import io.chimera.core.conversation.ConversationSnapshot;
import io.chimera.core.conversation.InjectedMemory;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextBuilderTest {
    private static final Instant BASE = Instant.parse("2025-01-01T10:00:00Z");

    private final ContextBuilder builder = new ContextBuilder();

    @Test
    void shouldIncludeOnlyActiveMemories() {
        ConversationSnapshot conversation = new ConversationSnapshot(
            "gpt-4",
            List.of(),
            List.of(
                InjectedMemory.of("A", "alpha facts", true),
                InjectedMemory.of("B", "beta facts", true),
                InjectedMemory.of("C", "gamma facts", false)
            )
        );

        ConversationContext context = builder.build(conversation, "hello");

        assertThat(context.memoryBlock())
            .startsWith("=== Injected Context ===")
            .endsWith("=== End Context ===")
            .contains("[A]\nalpha facts", "[B]\nbeta facts")
            .doesNotContain("[C]", "gamma facts");
        assertThat(context.hasMemory()).isTrue();
        assertThat(context.systemContent())
            .startsWith(ContextBuilder.SYSTEM_PROMPT)
            .contains("[A]");
    }

    @Test
    void shouldOmitMemoryBlockWhenNoLinkIsActive() {
        ConversationSnapshot conversation = new ConversationSnapshot(
            "gpt-4",
            List.of(),
            List.of(InjectedMemory.of("C", "gamma facts", false))
        );

        ConversationContext context = builder.build(conversation, "hello");

        assertThat(context.memoryBlock()).isEmpty();
        assertThat(context.hasMemory()).isFalse();
        assertThat(context.systemContent()).isEqualTo(ContextBuilder.SYSTEM_PROMPT);
    }

    @Test
    void shouldKeepTenMostRecentMessagesOldestFirst() {
        List<ConversationMessage> messages = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            MessageRole role = i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT;
            messages.add(new ConversationMessage(role, "message " + i, BASE.plusSeconds(i)));
        }
        ConversationSnapshot conversation = new ConversationSnapshot("gpt-4", messages, List.of());

        ConversationContext context = builder.build(conversation, "current question");

        assertThat(context.history()).hasSize(10);
        assertThat(context.history())
            .extracting(ChatMessage::content)
            .containsExactly(
                "message 5", "message 6", "message 7", "message 8", "message 9",
                "message 10", "message 11", "message 12", "message 13", "message 14"
            );
        assertThat(context.history()).extracting(ChatMessage::content).doesNotContain("current question");
        assertThat(context.userMessage()).isEqualTo("current question");
    }

    @Test
    void shouldOrderHistoryByTimestampRegardlessOfStorageOrder() {
        List<ConversationMessage> messages = List.of(
            new ConversationMessage(MessageRole.ASSISTANT, "second", BASE.plusSeconds(2)),
            new ConversationMessage(MessageRole.USER, "third", BASE.plusSeconds(3)),
            new ConversationMessage(MessageRole.USER, "first", BASE.plusSeconds(1))
        );

        ConversationContext context = builder.build(new ConversationSnapshot("gpt-4", messages, List.of()), "next");

        assertThat(context.history()).extracting(ChatMessage::content).containsExactly("first", "second", "third");
    }

    @Test
    void shouldReadActivationStateAtBuildTime() {
        ToggleableMemory memory = new ToggleableMemory("Later", "switched on afterwards");
        ConversationSnapshot conversation = new ConversationSnapshot("gpt-4", List.of(), List.of(memory));

        assertThat(builder.build(conversation, "hi").memoryBlock()).isEmpty();

        memory.active = true;

        assertThat(builder.build(conversation, "hi").memoryBlock()).contains("[Later]");
    }

    private static final class ToggleableMemory implements InjectedMemory {
        private final String title;
        private final String content;
        private boolean active;

        private ToggleableMemory(String title, String content) {
            this.title = title;
            this.content = content;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public String content() {
            return content;
        }

        @Override
        public boolean active() {
            return active;
        }
    }
}
