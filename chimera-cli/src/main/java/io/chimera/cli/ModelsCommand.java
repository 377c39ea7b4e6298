package io.chimera.cli;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "models", description = "List supported models grouped by provider")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Map<String, List<String>> models = context.dispatcher().listSupportedModels();
        models.forEach((provider, names) -> System.out.println(provider + ": " + String.join(", ", names)));
        return 0;
    }
}
