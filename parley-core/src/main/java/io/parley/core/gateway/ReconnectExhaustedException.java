package io.parley.core.gateway;

public class ReconnectExhaustedException extends ConnectionLostException {

    public ReconnectExhaustedException(String message) {
        super(message);
    }
}
