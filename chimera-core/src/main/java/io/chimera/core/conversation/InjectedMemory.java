package io.chimera.core.conversation;

/**
 * A memory linked into a conversation. The active flag is owned by whoever manages the link;
 * the router only reads it.
 */
public interface InjectedMemory {
    String title();

    String content();

    boolean active();

    static InjectedMemory of(String title, String content, boolean active) {
        return new MemoryLink(title, content, active);
    }
}
