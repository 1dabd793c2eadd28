package io.parley.cli;

import io.parley.core.config.model.ParleyConfig;
import io.parley.core.engine.ConversationEngine;
import io.parley.core.gateway.ConnectionFailureException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show engine, session and brain connection status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Option(names = "--offline", description = "Do not try to connect to the brain")
    boolean offline;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ParleyConfig parleyConfig;
        try {
            parleyConfig = context.loadConfig(config.path);
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }

        System.out.println("Brain endpoint: " + parleyConfig.gateway().uri());
        try (ConversationEngine engine = context.engineFactory().create(parleyConfig)) {
            int exitCode = 0;
            if (!offline) {
                try {
                    engine.start();
                } catch (ConnectionFailureException e) {
                    System.err.println("Brain unreachable: " + e.getMessage());
                    exitCode = 1;
                }
            }
            System.out.println(context.configService().toPrettyJson(engine.status()));
            return exitCode;
        }
    }
}
