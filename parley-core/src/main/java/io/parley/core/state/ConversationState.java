package io.parley.core.state;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum ConversationState {
    IDLE,
    GREETING,
    QUERYING,
    DEBRIEFING,
    ACTION_REQUESTED,
    CLARIFYING,
    CONFIRMING,
    FOLLOWING_UP,
    MULTI_TURN_TASK,
    ERROR_RECOVERY,
    FAREWELL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ConversationState> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ConversationState state : values()) {
            if (state.name().equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
