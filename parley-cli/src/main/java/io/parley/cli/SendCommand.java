package io.parley.cli;

import io.parley.core.config.model.ParleyConfig;
import io.parley.core.engine.BrainResponse;
import io.parley.core.engine.ConversationEngine;
import io.parley.core.engine.SuggestedAction;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "send", description = "Send one utterance to the brain and print the reply")
public final class SendCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Parameters(index = "0", arity = "1", description = "Utterance to send")
    String text;

    @Option(names = "--json", description = "Print the full parsed response as JSON")
    boolean json;

    public SendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ParleyConfig parleyConfig;
        try {
            parleyConfig = context.loadConfig(config.path);
        } catch (Exception e) {
            System.err.println("Send command failed: " + e.getMessage());
            return 1;
        }

        try (ConversationEngine engine = context.engineFactory().create(parleyConfig)) {
            BrainResponse response = engine.process(text);
            if (json) {
                System.out.println(context.configService().toPrettyJson(response));
            } else {
                System.out.println(response.text());
                if (response.followUpPrompt() != null) {
                    System.out.println(response.followUpPrompt());
                }
                for (SuggestedAction action : response.actions()) {
                    System.out.println("action: " + action.action() + " " + action.params());
                }
            }
            return response.isError() ? 1 : 0;
        }
    }
}
