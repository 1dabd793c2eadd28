package io.parley.core.context;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Role {
    USER,
    BRAIN,
    SYSTEM;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
