package io.chimera.cli;

import picocli.CommandLine.Command;

@Command(name = "chimera", mixinStandardHelpOptions = true, description = "Chimera multi-provider LLM router")
public final class ChimeraCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
