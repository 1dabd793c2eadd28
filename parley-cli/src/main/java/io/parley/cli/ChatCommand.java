package io.parley.cli;

import io.parley.core.config.model.ParleyConfig;
import io.parley.core.engine.BrainResponse;
import io.parley.core.engine.ConversationEngine;
import io.parley.core.engine.ConversationListener;
import io.parley.core.engine.SuggestedAction;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Line-oriented chat over stdin. {@code /new}, {@code /status} and {@code /quit} are handled locally. */
@Command(name = "chat", description = "Interactive conversation with the brain")
public final class ChatCommand implements Callable<Integer> {
    private static final String PROMPT = "you> ";
    private static final String REPLY = "brain> ";

    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Option(names = "--stream", description = "Print partial replies as the brain streams them")
    boolean stream;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ParleyConfig parleyConfig;
        try {
            parleyConfig = context.loadConfig(config.path);
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }

        try (ConversationEngine engine = context.engineFactory().create(parleyConfig)) {
            engine.addListener(new ConversationListener() {
                @Override
                public void onAction(SuggestedAction action) {
                    System.out.println("  [action] " + action.action() + " " + action.params());
                }
            });
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            System.out.println("Session " + engine.sessionId() + " (/new, /status, /quit)");
            while (true) {
                System.out.print(PROMPT);
                System.out.flush();
                String line = reader.readLine();
                if (line == null || "/quit".equals(line.trim())) {
                    break;
                }
                String input = line.trim();
                if (input.isEmpty()) {
                    continue;
                }
                if ("/new".equals(input)) {
                    System.out.println("Session " + engine.newSession());
                    continue;
                }
                if ("/status".equals(input)) {
                    System.out.println(context.configService().toPrettyJson(engine.status()));
                    continue;
                }
                converse(engine, input);
            }
            return 0;
        } catch (IOException e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private void converse(ConversationEngine engine, String input) {
        if (!stream) {
            BrainResponse response = engine.process(input);
            System.out.println(REPLY + response.text());
            printFollowUp(response);
            return;
        }
        System.out.print(REPLY);
        StreamPrinter printer = new StreamPrinter();
        BrainResponse response = engine.process(input, Map.of(), printer);
        if (!printer.printedAny) {
            System.out.print(response.text());
        }
        System.out.println();
        printFollowUp(response);
    }

    private static void printFollowUp(BrainResponse response) {
        if (response.followUpPrompt() != null) {
            System.out.println(REPLY + response.followUpPrompt());
        }
    }

    private static final class StreamPrinter implements Consumer<String> {
        private volatile boolean printedAny;

        @Override
        public void accept(String chunk) {
            printedAny = true;
            System.out.print(chunk);
            System.out.flush();
        }
    }
}
