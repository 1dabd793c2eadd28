package io.parley.core.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConversationContext {
    public static final int MAX_TOPIC_DEPTH = 20;
    public static final int DEFAULT_RECENT_ENTITY_LIMIT = 15;
    public static final int DEFAULT_TOPIC_HISTORY_LIMIT = 5;

    private static final Logger LOG = LoggerFactory.getLogger(ConversationContext.class);

    // least referenced first, then stalest, then earliest touched
    private static final Comparator<TrackedEntity> EVICTION_ORDER = Comparator
        .comparingInt(TrackedEntity::referenceCount)
        .thenComparing(TrackedEntity::lastReferencedAt)
        .thenComparingLong(TrackedEntity::referenceSequence);

    private static final Comparator<TrackedEntity> RECENCY_ORDER = Comparator
        .comparing(TrackedEntity::lastReferencedAt)
        .thenComparingLong(TrackedEntity::referenceSequence)
        .reversed();

    private final String sessionId;
    private final int windowSize;
    private final int maxEntities;
    private final Clock clock;
    private final Instant createdAt;

    private final List<Turn> turns = new ArrayList<>();
    private final Map<String, TrackedEntity> entities = new LinkedHashMap<>();
    private final Map<String, TrackedEntity> lookup = new HashMap<>();
    private final Deque<String> topics = new ArrayDeque<>();
    private String summary = "";
    private long referenceSequence;

    public ConversationContext(int windowSize, int maxEntities) {
        this(UUID.randomUUID().toString(), windowSize, maxEntities, Clock.systemUTC());
    }

    public ConversationContext(String sessionId, int windowSize, int maxEntities, Clock clock) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        if (maxEntities < 1) {
            throw new IllegalArgumentException("maxEntities must be at least 1");
        }
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.windowSize = windowSize;
        this.maxEntities = maxEntities;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.createdAt = clock.instant();
    }

    public String sessionId() {
        return sessionId;
    }

    public int windowSize() {
        return windowSize;
    }

    public int maxEntities() {
        return maxEntities;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Turn addTurn(Role role, String content, Map<String, Object> metadata) {
        return addTurn(role, content, null, List.of(), metadata);
    }

    public synchronized Turn addTurn(
        Role role,
        String content,
        String intent,
        List<String> entityNames,
        Map<String, Object> metadata
    ) {
        Objects.requireNonNull(role, "role must not be null");
        Turn turn = new Turn(
            UUID.randomUUID().toString(),
            role,
            content,
            clock.instant(),
            withoutBlanks(entityNames),
            intent,
            metadata
        );
        turns.add(turn);
        return turn;
    }

    public Turn addUserTurn(String content) {
        return addTurn(Role.USER, content, Map.of());
    }

    public Turn addBrainTurn(String content, String intent, List<String> entityNames, Map<String, Object> metadata) {
        return addTurn(Role.BRAIN, content, intent, entityNames, metadata);
    }

    public Turn addSystemTurn(String content) {
        return addTurn(Role.SYSTEM, content, Map.of());
    }

    public synchronized List<Turn> window() {
        int from = Math.max(0, turns.size() - windowSize);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public synchronized List<Turn> allTurns() {
        return List.copyOf(turns);
    }

    public synchronized int turnCount() {
        return turns.size();
    }

    public synchronized TrackedEntity trackEntity(
        String name,
        EntityType type,
        List<String> aliases,
        Map<String, Object> metadata
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("entity name must not be blank");
        }
        Instant now = clock.instant();
        TrackedEntity existing = lookup.get(TrackedEntity.normalize(name));
        if (existing != null) {
            existing.touch(now, ++referenceSequence);
            for (String alias : existing.mergeAliases(unclaimed(aliases, existing))) {
                lookup.put(TrackedEntity.normalize(alias), existing);
            }
            existing.mergeMetadata(metadata);
            return existing;
        }

        TrackedEntity created = new TrackedEntity(
            UUID.randomUUID().toString(),
            name.trim(),
            type,
            now,
            ++referenceSequence
        );
        created.mergeAliases(unclaimed(aliases, created));
        created.mergeMetadata(metadata);
        entities.put(created.id(), created);
        for (String key : created.lookupKeys()) {
            lookup.put(key, created);
        }
        evictOverCapacity();
        return created;
    }

    public synchronized Optional<TrackedEntity> findEntity(String nameOrAlias) {
        if (nameOrAlias == null || nameOrAlias.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookup.get(TrackedEntity.normalize(nameOrAlias)));
    }

    public synchronized List<TrackedEntity> recentEntities(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return entities.values().stream()
            .sorted(RECENCY_ORDER)
            .limit(limit)
            .toList();
    }

    public synchronized List<TrackedEntity> entitiesByType(EntityType type) {
        return entities.values().stream()
            .filter(entity -> entity.type() == type)
            .toList();
    }

    public synchronized int entityCount() {
        return entities.size();
    }

    public synchronized void pushTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            return;
        }
        String trimmed = topic.trim();
        if (trimmed.equals(topics.peekLast())) {
            return;
        }
        topics.addLast(trimmed);
        while (topics.size() > MAX_TOPIC_DEPTH) {
            topics.pollFirst();
        }
    }

    public synchronized Optional<String> currentTopic() {
        return Optional.ofNullable(topics.peekLast());
    }

    public synchronized Optional<String> popTopic() {
        return Optional.ofNullable(topics.pollLast());
    }

    public synchronized List<String> topicHistory(int limit) {
        List<String> all = new ArrayList<>(topics);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized void updateSummary(String text) {
        summary = text == null ? "" : text;
    }

    public synchronized String summary() {
        return summary;
    }

    public OutboundContext buildOutboundPayload() {
        return buildOutboundPayload(DEFAULT_RECENT_ENTITY_LIMIT, DEFAULT_TOPIC_HISTORY_LIMIT);
    }

    public synchronized OutboundContext buildOutboundPayload(int recentEntityLimit, int topicHistoryLimit) {
        List<OutboundContext.TurnView> turnViews = window().stream()
            .map(OutboundContext.TurnView::of)
            .toList();
        List<OutboundContext.EntityView> entityViews = recentEntities(recentEntityLimit).stream()
            .map(OutboundContext.EntityView::of)
            .toList();
        return new OutboundContext(
            sessionId,
            summary,
            topics.peekLast(),
            topicHistory(topicHistoryLimit),
            turnViews,
            entityViews,
            turns.size(),
            sessionAgeSeconds()
        );
    }

    public synchronized SessionInfo describe() {
        return new SessionInfo(sessionId, createdAt, turns.size(), entities.size(), topics.peekLast(), summary);
    }

    private double sessionAgeSeconds() {
        Duration age = Duration.between(createdAt, clock.instant());
        return age.toMillis() / 1000.0;
    }

    // an alias stays with the first entity that claimed it, so every lookup key has exactly one owner
    private List<String> unclaimed(List<String> aliases, TrackedEntity owner) {
        if (aliases == null || aliases.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(aliases.size());
        for (String alias : aliases) {
            if (alias == null || alias.isBlank()) {
                continue;
            }
            TrackedEntity holder = lookup.get(TrackedEntity.normalize(alias));
            if (holder != null && holder != owner) {
                LOG.debug("Alias '{}' already belongs to entity {}, not adding it to {}", alias, holder.id(), owner.id());
                continue;
            }
            result.add(alias);
        }
        return result;
    }

    private void evictOverCapacity() {
        if (entities.size() <= maxEntities) {
            return;
        }
        List<TrackedEntity> candidates = new ArrayList<>(entities.values());
        candidates.sort(EVICTION_ORDER);
        int excess = entities.size() - maxEntities;
        for (TrackedEntity victim : candidates.subList(0, excess)) {
            entities.remove(victim.id());
            lookup.values().removeIf(owner -> owner == victim);
            LOG.debug("Evicted entity '{}' (refs={})", victim.canonicalName(), victim.referenceCount());
        }
    }

    private static List<String> withoutBlanks(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
