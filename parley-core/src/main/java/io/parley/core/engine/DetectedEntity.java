package io.parley.core.engine;

import io.parley.core.context.EntityType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record DetectedEntity(String name, EntityType type, List<String> aliases, Map<String, Object> metadata) {
    public DetectedEntity {
        Objects.requireNonNull(name, "name must not be null");
        type = type == null ? EntityType.OTHER : type;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
