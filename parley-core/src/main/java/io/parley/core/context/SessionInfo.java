package io.parley.core.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SessionInfo(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("turn_count") int turnCount,
    @JsonProperty("entity_count") int entityCount,
    @JsonProperty("current_topic") String currentTopic,
    @JsonProperty("session_summary") String sessionSummary
) {
}
