package io.chimera.core.config;

import java.nio.file.Path;
import java.util.function.Function;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "CHIMERA_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return defaultConfigPath(System::getenv);
    }

    public static Path defaultConfigPath(Function<String, String> environment) {
        String override = environment.apply(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            return expandHome(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".chimera", "config.json");
    }

    static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
