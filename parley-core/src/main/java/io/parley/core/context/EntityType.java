package io.parley.core.context;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EntityType {
    PERSON,
    COMPANY,
    DEAL,
    LOCATION,
    PHONE,
    DATE,
    OTHER;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntityType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
