package io.parley.core.gateway;

public class BrainErrorException extends GatewayException {
    private final String requestId;
    private final String brainError;

    public BrainErrorException(String requestId, String brainError) {
        super("Brain error: " + brainError);
        this.requestId = requestId;
        this.brainError = brainError;
    }

    public String requestId() {
        return requestId;
    }

    public String brainError() {
        return brainError;
    }
}
