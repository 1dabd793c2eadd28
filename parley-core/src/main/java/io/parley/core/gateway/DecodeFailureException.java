package io.parley.core.gateway;

public class DecodeFailureException extends GatewayException {

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
