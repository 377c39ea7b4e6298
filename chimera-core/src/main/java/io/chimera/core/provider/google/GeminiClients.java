package io.chimera.core.provider.google;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capability probe choosing the Gemini client: the GenAI SDK when present, otherwise the legacy
 * REST shape, otherwise nothing.
 *
 * <p>OkHttp is a required dependency of this module, so the last case only happens on a runtime
 * assembled without it (a shaded or trimmed distribution).
 */
public final class GeminiClients {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiClients.class);

    private GeminiClients() {
    }

    public static Optional<GeminiClient> select(String apiBase, Duration timeout) {
        return select(GeminiClients::classPresent, apiBase, timeout);
    }

    static Optional<GeminiClient> select(Predicate<String> classPresent, String apiBase, Duration timeout) {
        if (classPresent.test(GenAiSdkGeminiClient.CLIENT_CLASS)) {
            LOG.debug("Using Google GenAI client for Gemini calls");
            return Optional.of(new GenAiSdkGeminiClient(timeout));
        }
        if (classPresent.test(LegacyRestGeminiClient.CLIENT_CLASS)) {
            LOG.warn("Google GenAI client not found on the classpath, using legacy REST calls for Gemini");
            return Optional.of(new LegacyRestGeminiClient(apiBase, timeout));
        }
        LOG.warn("No Gemini client available; Google models will report an unsupported capability");
        return Optional.empty();
    }

    static boolean classPresent(String className) {
        try {
            Class.forName(className, false, GeminiClients.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.debug("Class {} not loadable: {}", className, e.toString());
            return false;
        }
    }
}
