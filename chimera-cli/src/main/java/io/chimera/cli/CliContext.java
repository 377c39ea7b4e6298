package io.chimera.cli;

import io.chimera.core.config.ConfigService;
import io.chimera.core.provider.ProviderDispatcher;
import java.nio.file.Path;
import java.util.function.Function;

public record CliContext(
    ProviderDispatcher dispatcher,
    ConfigService configService,
    Path configPath,
    Function<String, String> environment
) {
    public CliContext(ProviderDispatcher dispatcher, ConfigService configService, Path configPath) {
        this(dispatcher, configService, configPath, System::getenv);
    }
}
