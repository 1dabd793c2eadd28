package io.parley.core.gateway;

public class ConnectionFailureException extends GatewayException {

    public ConnectionFailureException(String message) {
        super(message);
    }

    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
