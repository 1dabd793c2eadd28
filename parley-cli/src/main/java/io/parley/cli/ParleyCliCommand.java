package io.parley.cli;

import picocli.CommandLine.Command;

@Command(name = "parley", mixinStandardHelpOptions = true, description = "Conversational session manager for a remote brain")
public final class ParleyCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
