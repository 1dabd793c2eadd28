package io.parley.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record StateInfo(
    @JsonProperty("current_state") ConversationState currentState,
    @JsonProperty("entered_at") Instant enteredAt,
    @JsonProperty("duration_seconds") double durationSeconds,
    @JsonProperty("total_transitions") int totalTransitions,
    @JsonProperty("recent_states") List<ConversationState> recentStates
) {
    public StateInfo {
        recentStates = List.copyOf(recentStates);
    }
}
