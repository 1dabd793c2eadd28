package io.parley.core.engine;

import io.parley.core.context.SessionInfo;
import io.parley.core.gateway.GatewayHealth;
import io.parley.core.state.StateInfo;
import java.util.Map;

public record EngineStatus(
    SessionInfo session,
    StateInfo state,
    GatewayHealth gateway,
    Map<String, Object> config
) {
}
