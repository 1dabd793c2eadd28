package io.parley.core.gateway;

import java.time.Duration;

public class ResponseTimeoutException extends GatewayException {
    private final String requestId;
    private final Duration timeout;

    public ResponseTimeoutException(String requestId, Duration timeout) {
        super("Brain did not respond to " + requestId + " within " + timeout.toMillis() + "ms");
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String requestId() {
        return requestId;
    }

    public Duration timeout() {
        return timeout;
    }
}
