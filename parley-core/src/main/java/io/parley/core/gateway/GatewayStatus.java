package io.parley.core.gateway;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum GatewayStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FATAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
