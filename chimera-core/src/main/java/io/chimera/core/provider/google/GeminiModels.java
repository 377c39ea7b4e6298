package io.chimera.core.provider.google;

import java.util.Map;

/**
 * Substitutes requested Gemini names that are not served upstream with the closest available model.
 */
public final class GeminiModels {
    private static final Map<String, String> UPSTREAM = Map.of(
        "gemini-2.5-flash", "gemini-2.0-flash",
        "gemini-2.5-pro", "gemini-1.5-pro",
        "gemini-2.0-flash-lite", "gemini-2.0-flash"
    );

    private GeminiModels() {
    }

    public static String upstreamName(String requested) {
        if (requested == null) {
            return "";
        }
        return UPSTREAM.getOrDefault(requested, requested);
    }
}
