package io.parley.core.gateway;

import java.io.IOException;

public class GatewayException extends IOException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
