package io.chimera.core.provider.google;

/**
 * Client-neutral answer from a Gemini call.
 *
 * @param blocked the provider attached a safety signal (prompt feedback or a safety finish reason)
 */
public record GeminiReply(String text, String servedModel, int totalTokens, boolean blocked) {

    public GeminiReply {
        text = text == null ? "" : text;
        totalTokens = Math.max(0, totalTokens);
    }
}
