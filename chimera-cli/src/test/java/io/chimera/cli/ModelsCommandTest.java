package io.chimera.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.chimera.core.config.ConfigService;
import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.config.model.ProvidersConfig;
import io.chimera.core.config.model.RouterConfig;
import io.chimera.core.provider.ProviderDispatcher;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ModelsCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListModelsPerProvider() {
        ChimeraConfig config = new ChimeraConfig(
            new RouterConfig("model-", Map.of("mistral-large", "groq")),
            ProvidersConfig.defaults()
        );
        CliContext context = new CliContext(
            ProviderDispatcher.fromConfig(config, name -> null),
            new ConfigService(),
            tempDir.resolve("config.json")
        );

        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new ModelsCommand(context)).execute();
            assertThat(code).isEqualTo(0);
        } finally {
            System.setOut(originalOut);
        }

        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("openai: gpt-4, gpt-4-turbo, gpt-4o, gpt-3.5-turbo")
            .contains("echo: echo")
            .containsPattern("groq: .*mistral-large");
    }
}
