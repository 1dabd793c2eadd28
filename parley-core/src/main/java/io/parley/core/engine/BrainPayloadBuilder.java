package io.parley.core.engine;

import io.parley.core.context.OutboundContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class BrainPayloadBuilder {
    public static final String COMPRESS_MESSAGE_TYPE = "context_compress";

    public static final String DEFAULT_SYSTEM_PROMPT = """
        You are the conversational engine behind a voice-first assistant. Each request carries the user's
        latest utterance and the session context: recent turns, tracked entities, the topic trail and a
        rolling summary of older turns.

        ## What to do
        - Work out what the user wants from meaning, never from keywords.
        - Resolve "him", "her", "that deal", "the other one" against tracked_entities, preferring the most
          recently referenced entity of the matching type. When unsure, give your best guess and ask.
        - Carry details across turns during debriefs and multi-step tasks; do not ask the user to repeat.
        - Offer the natural next step when there is one.
        - Keep answers short. Users are often driving or on a call.

        ## Response format
        Reply with a single JSON object and nothing else:
        {
          "response_text": "what to say to the user",
          "inferred_intent": "short label for what the user wants",
          "inferred_state": "idle | greeting | querying | debriefing | action_requested | clarifying | confirming | following_up | multi_turn_task | error_recovery | farewell",
          "entities_detected": [{"name": "...", "type": "person | company | deal | location | phone | date | other", "aliases": []}],
          "suggested_actions": [{"action": "action_type", "params": {}, "label": "human readable label"}],
          "follow_up_prompt": "next-step question or null",
          "confidence": 0.0,
          "needs_clarification": false,
          "context_summary_update": "updated session summary when the context is getting long, else null"
        }
        """;

    static final String COMPRESS_SYSTEM_PROMPT = "Summarize this conversation history into a concise paragraph. "
        + "Keep every entity name, key decisions, action items, open questions and the current topic. "
        + "Respond with ONLY the summary text, no JSON.";
    static final String COMPRESS_USER_MESSAGE = "Please compress the conversation context.";

    private final String systemPrompt;

    public BrainPayloadBuilder() {
        this(null);
    }

    public BrainPayloadBuilder(String systemPromptOverride) {
        this.systemPrompt = systemPromptOverride == null || systemPromptOverride.isBlank()
            ? DEFAULT_SYSTEM_PROMPT
            : systemPromptOverride;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public Map<String, Object> conversation(String userMessage, OutboundContext context, Map<String, Object> userProfile) {
        Objects.requireNonNull(context, "context must not be null");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("system_prompt", systemPrompt);
        payload.put("user_message", userMessage == null ? "" : userMessage);
        payload.put("context", context);
        if (userProfile != null && !userProfile.isEmpty()) {
            payload.put("user_profile", userProfile);
        }
        return payload;
    }

    public Map<String, Object> compression(OutboundContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", COMPRESS_MESSAGE_TYPE);
        payload.put("system_prompt", COMPRESS_SYSTEM_PROMPT);
        payload.put("user_message", COMPRESS_USER_MESSAGE);
        payload.put("context", context);
        return payload;
    }
}
