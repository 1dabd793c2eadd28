package io.parley.core.gateway;

public class ConnectionLostException extends GatewayException {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
