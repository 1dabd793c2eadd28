package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ParleyConfig(
    GatewayConfig gateway,
    EngineConfig engine
) {

    public static ParleyConfig defaults() {
        return new ParleyConfig(
            GatewayConfig.defaults(),
            EngineConfig.defaults()
        );
    }

    public ParleyConfig withGateway(GatewayConfig gateway) {
        return new ParleyConfig(gateway, engine);
    }
}
