package io.parley.cli;

import picocli.CommandLine.Option;

public final class ConfigOption {

    @Option(names = {"-c", "--config"}, description = "Config file (default: ~/.parley/config.json)")
    String path;
}
