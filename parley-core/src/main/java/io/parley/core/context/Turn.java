package io.parley.core.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Turn(
    String id,
    Role role,
    String content,
    Instant timestamp,
    List<String> entities,
    String intent,
    Map<String, Object> metadata
) {
    public Turn {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        content = content == null ? "" : content;
        entities = entities == null ? List.of() : List.copyOf(entities);
        // metadata values may be null, so Map.copyOf is not an option
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
