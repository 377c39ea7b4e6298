package io.chimera.core.model;

import java.util.Locale;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
