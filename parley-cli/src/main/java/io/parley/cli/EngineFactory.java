package io.parley.cli;

import io.parley.core.config.model.ParleyConfig;
import io.parley.core.engine.ConversationEngine;

@FunctionalInterface
public interface EngineFactory {
    ConversationEngine create(ParleyConfig config);
}
