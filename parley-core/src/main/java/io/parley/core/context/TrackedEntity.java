package io.parley.core.context;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class TrackedEntity {
    private final String id;
    private final String canonicalName;
    private final EntityType type;
    private final List<String> aliases = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private Instant lastReferencedAt;
    private long referenceSequence;
    private int referenceCount;

    TrackedEntity(String id, String canonicalName, EntityType type, Instant referencedAt, long sequence) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.canonicalName = Objects.requireNonNull(canonicalName, "canonicalName must not be null");
        this.type = type == null ? EntityType.OTHER : type;
        this.lastReferencedAt = Objects.requireNonNull(referencedAt, "referencedAt must not be null");
        this.referenceSequence = sequence;
        this.referenceCount = 1;
    }

    public String id() {
        return id;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public EntityType type() {
        return type;
    }

    public List<String> aliases() {
        return Collections.unmodifiableList(new ArrayList<>(aliases));
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Instant lastReferencedAt() {
        return lastReferencedAt;
    }

    public int referenceCount() {
        return referenceCount;
    }

    long referenceSequence() {
        return referenceSequence;
    }

    void touch(Instant now, long sequence) {
        lastReferencedAt = now;
        referenceSequence = sequence;
        referenceCount++;
    }

    List<String> mergeAliases(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<String> added = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String alias = candidate.trim();
            if (matches(alias)) {
                continue;
            }
            aliases.add(alias);
            added.add(alias);
        }
        return added;
    }

    void mergeMetadata(Map<String, Object> values) {
        if (values != null) {
            metadata.putAll(values);
        }
    }

    boolean matches(String nameOrAlias) {
        String needle = normalize(nameOrAlias);
        if (normalize(canonicalName).equals(needle)) {
            return true;
        }
        for (String alias : aliases) {
            if (normalize(alias).equals(needle)) {
                return true;
            }
        }
        return false;
    }

    List<String> lookupKeys() {
        List<String> keys = new ArrayList<>(aliases.size() + 1);
        keys.add(normalize(canonicalName));
        for (String alias : aliases) {
            keys.add(normalize(alias));
        }
        return keys;
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
