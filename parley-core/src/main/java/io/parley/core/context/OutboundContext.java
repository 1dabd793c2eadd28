package io.parley.core.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record OutboundContext(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("session_summary") String sessionSummary,
    @JsonProperty("current_topic") String currentTopic,
    @JsonProperty("topic_history") List<String> topicHistory,
    @JsonProperty("turns") List<TurnView> turns,
    @JsonProperty("tracked_entities") List<EntityView> trackedEntities,
    @JsonProperty("turn_count") int turnCount,
    @JsonProperty("session_age_seconds") double sessionAgeSeconds
) {
    public OutboundContext {
        topicHistory = List.copyOf(topicHistory);
        turns = List.copyOf(turns);
        trackedEntities = List.copyOf(trackedEntities);
    }

    public record TurnView(
        String role,
        String content,
        Instant timestamp,
        String intent,
        List<String> entities
    ) {
        static TurnView of(Turn turn) {
            return new TurnView(
                turn.role().wireValue(),
                turn.content(),
                turn.timestamp(),
                turn.intent(),
                turn.entities()
            );
        }
    }

    public record EntityView(
        String id,
        String name,
        String type,
        List<String> aliases,
        Map<String, Object> metadata,
        @JsonProperty("ref_count") int refCount
    ) {
        static EntityView of(TrackedEntity entity) {
            return new EntityView(
                entity.id(),
                entity.canonicalName(),
                entity.type().wireValue(),
                entity.aliases(),
                entity.metadata(),
                entity.referenceCount()
            );
        }
    }
}
