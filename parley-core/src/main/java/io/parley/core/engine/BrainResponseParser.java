package io.parley.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.context.EntityType;
import io.parley.core.gateway.DecodeFailureException;
import io.parley.core.state.ConversationState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a settled gateway frame into a {@link BrainResponse}. The structured fields may sit under
 * {@code content} or at the top level, and {@code content} may be a string holding JSON. Content that
 * does not decode is kept as plain text.
 */
public final class BrainResponseParser {
    private static final Logger LOG = LoggerFactory.getLogger(BrainResponseParser.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Set<String> ENTITY_FIELDS = Set.of("name", "type", "aliases");
    private static final Set<String> ACTION_FIELDS = Set.of("action", "params", "label");

    private final ObjectMapper mapper;

    public BrainResponseParser() {
        this(new ObjectMapper());
    }

    public BrainResponseParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public BrainResponse parse(JsonNode settled, double latencyMs) {
        JsonNode content = contentOf(settled);
        if (content == null || content.isNull() || content.isMissingNode()) {
            return BrainResponse.plainText("", latencyMs);
        }
        if (content.isTextual()) {
            String raw = content.asText();
            try {
                content = decode(raw);
            } catch (DecodeFailureException e) {
                LOG.debug("Treating brain response as plain text: {}", e.getMessage());
                return BrainResponse.plainText(raw, latencyMs);
            }
        } else if (!content.isObject()) {
            return BrainResponse.plainText(content.toString(), latencyMs);
        }

        return new BrainResponse(
            text(content, "response_text").orElse(""),
            text(content, "inferred_intent").orElse(null),
            state(content),
            entities(content.get("entities_detected")),
            actions(content.get("suggested_actions")),
            text(content, "follow_up_prompt").orElse(null),
            confidence(content.get("confidence")),
            content.path("needs_clarification").asBoolean(false),
            text(content, "context_summary_update").orElse(null),
            latencyMs
        );
    }

    public String summaryText(JsonNode settled) {
        JsonNode content = contentOf(settled);
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText().trim();
        }
        if (content.isObject()) {
            return text(content, "response_text").orElse(content.toString()).trim();
        }
        return content.toString();
    }

    JsonNode decode(String raw) throws DecodeFailureException {
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DecodeFailureException("Response content is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new DecodeFailureException("Response content is not a JSON object", null);
        }
        return node;
    }

    private static JsonNode contentOf(JsonNode settled) {
        if (settled == null) {
            return null;
        }
        return settled.has("content") ? settled.get("content") : settled;
    }

    private static ConversationState state(JsonNode content) {
        Optional<String> raw = text(content, "inferred_state");
        if (raw.isEmpty()) {
            return null;
        }
        Optional<ConversationState> parsed = ConversationState.fromWire(raw.get());
        if (parsed.isEmpty()) {
            LOG.warn("Unknown state from brain: {}", raw.get());
        }
        return parsed.orElse(null);
    }

    private List<DetectedEntity> entities(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<DetectedEntity> entities = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                entities.add(new DetectedEntity(item.asText().trim(), EntityType.OTHER, List.of(), Map.of()));
                continue;
            }
            Optional<String> name = text(item, "name");
            if (!item.isObject() || name.isEmpty()) {
                LOG.debug("Skipping nameless entity from brain: {}", item);
                continue;
            }
            entities.add(new DetectedEntity(
                name.get(),
                EntityType.fromWire(item.path("type").asText(null)),
                strings(item.get("aliases")),
                extras(item, ENTITY_FIELDS)
            ));
        }
        return entities;
    }

    private List<SuggestedAction> actions(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<SuggestedAction> actions = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                actions.add(SuggestedAction.of(item.asText().trim()));
                continue;
            }
            Optional<String> action = text(item, "action");
            if (!item.isObject() || action.isEmpty()) {
                LOG.debug("Skipping malformed action from brain: {}", item);
                continue;
            }
            Map<String, Object> params = new LinkedHashMap<>();
            JsonNode paramsNode = item.get("params");
            if (paramsNode != null && paramsNode.isObject()) {
                params.putAll(mapper.convertValue(paramsNode, MAP_TYPE));
            }
            params.putAll(extras(item, ACTION_FIELDS));
            actions.add(new SuggestedAction(action.get(), params, text(item, "label").orElse(null)));
        }
        return actions;
    }

    private Map<String, Object> extras(JsonNode item, Set<String> known) {
        Map<String, Object> extras = new LinkedHashMap<>();
        item.fields().forEachRemaining(entry -> {
            if (!known.contains(entry.getKey())) {
                extras.put(entry.getKey(), mapper.convertValue(entry.getValue(), Object.class));
            }
        });
        return extras;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return node.asText().isBlank() ? List.of() : List.of(node.asText().trim());
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        }
        return values;
    }

    private static double confidence(JsonNode node) {
        double value = 1.0;
        if (node != null && node.isNumber()) {
            value = node.asDouble();
        } else if (node != null && node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring non-numeric confidence '{}'", node.asText());
            }
        }
        if (Double.isNaN(value)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }
}
