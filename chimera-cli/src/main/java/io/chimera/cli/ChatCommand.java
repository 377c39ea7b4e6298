package io.chimera.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chimera.core.provider.ProviderResponse;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a single prompt to a model")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, defaultValue = "echo", description = "Model identifier (default: ${DEFAULT-VALUE})")
    String model;

    @Option(names = {"-c", "--context"}, description = "Context text placed ahead of the prompt")
    String contextText;

    @Option(names = "--json", description = "Print the full response envelope as JSON")
    boolean json;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ProviderResponse response = context.dispatcher().complete(model, prompt, contextText);
            if (json) {
                System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(response));
            } else if (response.isSuccess()) {
                System.out.println(response.reply());
            } else {
                System.err.println(response.reply());
            }
            return response.isSuccess() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
