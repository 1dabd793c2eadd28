package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

/**
 * Connection settings for the brain endpoint.
 *
 * <p>A {@code reconnectMaxAttempts} of zero retries forever. {@code pingIntervalMs} drives the
 * transport's own keep-alive frames; {@code healthCheckIntervalMs} drives the gateway's liveness probe,
 * which only sees what the transport has noticed. The OkHttp transport notices a dead socket through
 * missed pings alone, so it requires a positive {@code pingIntervalMs}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    String uri,
    long connectTimeoutMs,
    long reconnectDelayBaseMs,
    long reconnectDelayMaxMs,
    int reconnectMaxAttempts,
    long pingIntervalMs,
    long healthCheckIntervalMs,
    long responseTimeoutMs,
    int maxMessageSizeBytes
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig(
            "ws://127.0.0.1:18789",
            10_000,
            1_000,
            30_000,
            50,
            20_000,
            30_000,
            60_000,
            10 * 1024 * 1024
        );
    }

    public GatewayConfig withUri(String value) {
        return new GatewayConfig(
            value,
            connectTimeoutMs,
            reconnectDelayBaseMs,
            reconnectDelayMaxMs,
            reconnectMaxAttempts,
            pingIntervalMs,
            healthCheckIntervalMs,
            responseTimeoutMs,
            maxMessageSizeBytes
        );
    }

    @JsonIgnore
    public Duration connectTimeout() {
        return Duration.ofMillis(Math.max(1, connectTimeoutMs));
    }

    @JsonIgnore
    public Duration responseTimeout() {
        return Duration.ofMillis(Math.max(1, responseTimeoutMs));
    }

    @JsonIgnore
    public Duration healthCheckInterval() {
        return Duration.ofMillis(Math.max(1, healthCheckIntervalMs));
    }

    public Duration reconnectDelay(int attempt) {
        long base = Math.max(1, reconnectDelayBaseMs);
        long cap = Math.max(base, reconnectDelayMaxMs);
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = base << shift;
        if (delay <= 0 || delay > cap) {
            delay = cap;
        }
        return Duration.ofMillis(delay);
    }
}
