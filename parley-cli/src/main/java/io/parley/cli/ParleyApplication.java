package io.parley.cli;

import io.parley.core.config.ConfigPaths;
import io.parley.core.config.ConfigService;
import io.parley.core.config.model.ParleyConfig;
import io.parley.core.engine.ConversationEngine;
import io.parley.core.gateway.BrainGateway;
import java.util.Map;
import picocli.CommandLine;

public final class ParleyApplication {
    static final String BRAIN_URI_ENV = "PARLEY_BRAIN_URI";

    private ParleyApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.defaultConfigPath(),
            config -> buildEngine(applyEnvironment(config, System.getenv()))
        );
        System.exit(commandLine(context).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ParleyCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("send", new SendCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }

    static ParleyConfig applyEnvironment(ParleyConfig config, Map<String, String> environment) {
        String uri = environment.get(BRAIN_URI_ENV);
        if (uri == null || uri.isBlank()) {
            return config;
        }
        return config.withGateway(config.gateway().withUri(uri.trim()));
    }

    static ConversationEngine buildEngine(ParleyConfig config) {
        return new ConversationEngine(config.engine(), new BrainGateway(config.gateway()));
    }
}
