package io.parley.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record SuggestedAction(String action, Map<String, Object> params, String label) {
    public SuggestedAction {
        Objects.requireNonNull(action, "action must not be null");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static SuggestedAction of(String action) {
        return new SuggestedAction(action, Map.of(), null);
    }
}
