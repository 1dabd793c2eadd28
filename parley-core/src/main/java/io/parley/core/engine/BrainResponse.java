package io.parley.core.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.parley.core.state.ConversationState;
import java.util.List;

public record BrainResponse(
    @JsonProperty("text") String text,
    @JsonProperty("intent") String intent,
    @JsonProperty("state") ConversationState state,
    @JsonProperty("entities") List<DetectedEntity> entities,
    @JsonProperty("actions") List<SuggestedAction> actions,
    @JsonProperty("follow_up") String followUpPrompt,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("needs_clarification") boolean needsClarification,
    @JsonProperty("context_summary_update") String summaryUpdate,
    @JsonProperty("latency_ms") double latencyMs
) {
    public static final String ERROR_INTENT = "error";

    public BrainResponse {
        text = text == null ? "" : text;
        entities = entities == null ? List.of() : List.copyOf(entities);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static BrainResponse plainText(String text, double latencyMs) {
        return new BrainResponse(text, null, null, List.of(), List.of(), null, 1.0, false, null, latencyMs);
    }

    public static BrainResponse error(String message, double latencyMs) {
        return new BrainResponse(
            message,
            ERROR_INTENT,
            ConversationState.ERROR_RECOVERY,
            List.of(),
            List.of(),
            null,
            0.0,
            false,
            null,
            latencyMs
        );
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR_INTENT.equals(intent) && state == ConversationState.ERROR_RECOVERY;
    }

    public BrainResponse withActions(List<SuggestedAction> replacement) {
        return new BrainResponse(
            text,
            intent,
            state,
            entities,
            replacement,
            followUpPrompt,
            confidence,
            needsClarification,
            summaryUpdate,
            latencyMs
        );
    }
}
