package io.parley.core.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record StateSnapshot(
    ConversationState state,
    Instant enteredAt,
    Instant exitedAt,
    String triggerTurnId,
    Map<String, Object> metadata
) {
    public StateSnapshot {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(enteredAt, "enteredAt must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @JsonIgnore
    public boolean isCurrent() {
        return exitedAt == null;
    }

    StateSnapshot close(Instant at) {
        return new StateSnapshot(state, enteredAt, at, triggerTurnId, metadata);
    }

    public Duration duration(Clock clock) {
        Instant end = exitedAt != null ? exitedAt : clock.instant();
        return Duration.between(enteredAt, end);
    }
}
