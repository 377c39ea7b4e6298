package io.chimera.cli;

import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.config.model.ProviderConfig;
import io.chimera.core.provider.ProviderTag;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and credential status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChimeraConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Identifier prefix: " + config.router().identifierPrefix());
            for (ProviderTag provider : ProviderTag.values()) {
                if (provider.credentialEnv().isBlank()) {
                    continue;
                }
                String variable = config.providers().forProvider(provider).credentialEnvOr(provider.credentialEnv());
                String value = context.environment().apply(variable);
                boolean present = value != null && !value.isBlank();
                System.out.println(provider.displayName() + " credential (" + variable + "): " + (present ? "set" : "missing"));
            }
            ProviderConfig local = config.providers().forProvider(ProviderTag.LOCAL);
            System.out.println("Local endpoint: " + (local.apiBase() == null || local.apiBase().isBlank() ? "placeholder" : local.apiBase()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
