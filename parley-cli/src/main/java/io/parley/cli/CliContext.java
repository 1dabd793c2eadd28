package io.parley.cli;

import io.parley.core.config.ConfigPaths;
import io.parley.core.config.ConfigService;
import io.parley.core.config.model.ParleyConfig;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    EngineFactory engineFactory
) {

    public ParleyConfig loadConfig(String configOverride) throws IOException {
        Path path = configOverride == null || configOverride.isBlank()
            ? configPath
            : ConfigPaths.resolve(configOverride);
        return configService.load(path);
    }
}
