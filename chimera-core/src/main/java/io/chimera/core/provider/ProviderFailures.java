package io.chimera.core.provider;

import java.util.List;
import java.util.Locale;

/**
 * Builds the error envelopes shared by all adapters and classifies call failures.
 */
public final class ProviderFailures {
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
        "429",
        "quota",
        "rate limit",
        "rate_limit",
        "ratelimit",
        "resource_exhausted",
        "too many requests"
    );
    private static final List<String> AUTH_MARKERS = List.of(
        "api_key_invalid",
        "api key not valid",
        "invalid api key",
        "invalid_api_key",
        "unauthorized"
    );

    private ProviderFailures() {
    }

    public static ProviderResponse missingCredential(ProviderTag provider, String model) {
        return ProviderResponse.failure(
            ProviderErrorKind.MISSING_CREDENTIAL,
            label(provider, model) + " No API key provided",
            model,
            provider,
            "No API key"
        );
    }

    public static ProviderResponse unsupportedCapability(ProviderTag provider, String model, String detail) {
        return ProviderResponse.failure(
            ProviderErrorKind.UNSUPPORTED_CAPABILITY,
            label(provider, model) + " " + detail,
            model,
            provider,
            "Client library not available"
        );
    }

    public static ProviderResponse contentBlocked(ProviderTag provider, String model) {
        return ProviderResponse.failure(
            ProviderErrorKind.CONTENT_BLOCKED,
            label(provider, model) + " Content was blocked by safety filters",
            model,
            provider,
            "Content blocked by safety filters"
        );
    }

    public static ProviderResponse emptyResponse(ProviderTag provider, String model) {
        return ProviderResponse.failure(
            ProviderErrorKind.GENERIC_PROVIDER_FAILURE,
            label(provider, model) + " No response generated",
            model,
            provider,
            "No response generated"
        );
    }

    public static ProviderResponse classify(ProviderTag provider, String model, Throwable failure) {
        String detail = describe(failure);
        int status = -1;
        String text = detail.toLowerCase(Locale.ROOT);
        if (failure instanceof ProviderHttpException http) {
            status = http.statusCode();
            text = http.body().toLowerCase(Locale.ROOT);
        }

        boolean authMarker = (status < 0 || status == 400) && containsAny(text, AUTH_MARKERS);
        if (status == 401 || status == 403 || authMarker) {
            return ProviderResponse.failure(
                ProviderErrorKind.AUTHENTICATION_REJECTED,
                label(provider, model) + " Authentication failed. Check the API key for this provider.",
                model,
                provider,
                detail
            );
        }
        if (status == 429 || containsAny(text, RATE_LIMIT_MARKERS)) {
            return ProviderResponse.failure(
                ProviderErrorKind.RATE_LIMIT_EXCEEDED,
                label(provider, model) + " Rate limit exceeded. Please wait and try again, or check your API quota.",
                model,
                provider,
                "Rate limit exceeded - quota exhausted"
            );
        }
        return ProviderResponse.failure(
            ProviderErrorKind.GENERIC_PROVIDER_FAILURE,
            label(provider, model) + " Error: " + detail,
            model,
            provider,
            detail
        );
    }

    static String label(ProviderTag provider, String model) {
        return "[" + provider.displayName() + " " + (model == null ? "" : model) + "]";
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown error";
        }
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return failure.getClass().getSimpleName();
        }
        return message;
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
