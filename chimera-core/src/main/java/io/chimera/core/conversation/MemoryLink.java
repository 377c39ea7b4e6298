package io.chimera.core.conversation;

public record MemoryLink(String title, String content, boolean active) implements InjectedMemory {

    public MemoryLink {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }
}
