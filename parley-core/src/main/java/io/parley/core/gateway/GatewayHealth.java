package io.parley.core.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record GatewayHealth(
    GatewayStatus status,
    String uri,
    @JsonProperty("messages_sent") long messagesSent,
    @JsonProperty("messages_received") long messagesReceived,
    @JsonProperty("pending_requests") int pendingRequests,
    @JsonProperty("avg_latency_ms") double avgLatencyMs,
    @JsonProperty("reconnect_attempts") int reconnectAttempts,
    @JsonProperty("total_reconnects") long totalReconnects,
    @JsonProperty("last_send") Instant lastSendAt,
    @JsonProperty("last_recv") Instant lastReceiveAt
) {
}
