package io.chimera.app;

import io.chimera.cli.ChatCommand;
import io.chimera.cli.ChimeraCliCommand;
import io.chimera.cli.CliContext;
import io.chimera.cli.ModelsCommand;
import io.chimera.cli.StatusCommand;
import io.chimera.core.config.ConfigPaths;
import io.chimera.core.config.ConfigService;
import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.provider.ProviderDispatcher;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ChimeraApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ChimeraApplication.class);

    private ChimeraApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        ChimeraConfig config = loadConfig(configService, configPath);

        ProviderDispatcher dispatcher = ProviderDispatcher.fromConfig(config, System::getenv);
        CliContext context = new CliContext(dispatcher, configService, configPath);

        CommandLine commandLine = new CommandLine(new ChimeraCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static ChimeraConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read config {}, using defaults: {}", configPath, e.getMessage());
            return ChimeraConfig.defaults();
        }
    }
}
