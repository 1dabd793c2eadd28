package io.parley.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.parley.core.config.model.EngineConfig;
import io.parley.core.context.ConversationContext;
import io.parley.core.context.OutboundContext;
import io.parley.core.context.Role;
import io.parley.core.context.Turn;
import io.parley.core.gateway.BrainGateway;
import io.parley.core.gateway.ConnectionFailureException;
import io.parley.core.gateway.ConnectionLostException;
import io.parley.core.gateway.GatewayException;
import io.parley.core.gateway.ResponseTimeoutException;
import io.parley.core.state.ConversationState;
import io.parley.core.state.StateTracker;
import io.parley.core.state.StateTransitionListener;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one session: records each utterance, asks the brain about it and folds the answer back into
 * memory and the state ledger. {@link #process} never throws for brain or connection trouble; it answers
 * with an apology response instead.
 */
public final class ConversationEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationEngine.class);

    static final String TIMEOUT_APOLOGY = "I'm having trouble reaching my brain right now. Could you repeat that in a moment?";
    static final String CONNECTION_APOLOGY = "I've lost my connection. Give me a second to reconnect.";
    static final String GENERIC_APOLOGY = "Something went wrong on my end. Let me try that again.";

    private final EngineConfig config;
    private final BrainGateway gateway;
    private final FallbackActionDetector fallbackDetector;
    private final Clock clock;
    private final BrainPayloadBuilder payloadBuilder;
    private final BrainResponseParser parser = new BrainResponseParser();
    private final List<ConversationListener> listeners = new CopyOnWriteArrayList<>();
    private final List<StateTransitionListener> stateListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean();
    private final Object turnLock = new Object();
    private final Object lifecycleLock = new Object();

    private volatile ConversationContext context;
    private volatile StateTracker state;
    private volatile Map<String, Object> userProfile = Map.of();
    private volatile boolean started;

    public ConversationEngine(EngineConfig config, BrainGateway gateway) {
        this(config, gateway, new PatternFallbackActionDetector(), Clock.systemUTC());
    }

    public ConversationEngine(
        EngineConfig config,
        BrainGateway gateway,
        FallbackActionDetector fallbackDetector,
        Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.fallbackDetector = fallbackDetector;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.payloadBuilder = new BrainPayloadBuilder(config.systemPromptOverride());
        this.context = newContext();
        this.state = new StateTracker(clock);
    }

    // Lifecycle

    public void start() throws ConnectionFailureException {
        synchronized (lifecycleLock) {
            if (started) {
                return;
            }
            gateway.connect();
            started = true;
            LOG.info("Conversation engine started for session {}", context.sessionId());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!started) {
                return;
            }
            started = false;
            gateway.disconnect();
            LOG.info("Conversation engine stopped");
        }
    }

    @Override
    public void close() {
        stop();
        gateway.close();
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isProcessing() {
        return processing.get();
    }

    // Observers

    public void addListener(ConversationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(ConversationListener listener) {
        listeners.remove(listener);
    }

    public void onStateTransition(StateTransitionListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        stateListeners.add(listener);
        state.onTransition(listener);
    }

    public void setUserProfile(Map<String, Object> profile) {
        userProfile = profile == null ? Map.of() : Map.copyOf(profile);
    }

    // Processing

    public BrainResponse process(String text) {
        return process(text, Map.of(), null);
    }

    public BrainResponse process(String text, Map<String, Object> metadata) {
        return process(text, metadata, null);
    }

    public BrainResponse process(String text, Map<String, Object> metadata, Consumer<String> streamSink) {
        Objects.requireNonNull(text, "text must not be null");
        synchronized (turnLock) {
            processing.set(true);
            long startedNanos = System.nanoTime();
            ConversationContext session = context;
            StateTracker ledger = state;
            Turn userTurn = null;
            try {
                userTurn = session.addTurn(Role.USER, text, metadata);
                start();
                maybeCompress(session);

                OutboundContext outbound = session.buildOutboundPayload(config.recentEntityLimit(), config.topicHistoryLimit());
                Map<String, Object> payload = payloadBuilder.conversation(text, outbound, userProfile);
                JsonNode raw = gateway.send(payload, config.responseTimeout(), streamSink);

                BrainResponse response = withFallbackActions(text, parser.parse(raw, elapsedMs(startedNanos)));
                apply(session, ledger, userTurn, response);
                dispatch(response);

                LOG.info(
                    "Processed turn {}: intent={} state={} confidence={} latency={}ms",
                    session.turnCount(),
                    response.intent(),
                    response.state() == null ? "-" : response.state().wireValue(),
                    String.format("%.2f", response.confidence()),
                    Math.round(response.latencyMs())
                );
                return response;
            } catch (ResponseTimeoutException e) {
                return recover(session, ledger, userTurn, TIMEOUT_APOLOGY, e, startedNanos);
            } catch (ConnectionFailureException | ConnectionLostException e) {
                return recover(session, ledger, userTurn, CONNECTION_APOLOGY, e, startedNanos);
            } catch (GatewayException e) {
                return recover(session, ledger, userTurn, GENERIC_APOLOGY, e, startedNanos);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error processing turn", e);
                return recover(session, ledger, userTurn, GENERIC_APOLOGY, e, startedNanos);
            } finally {
                processing.set(false);
            }
        }
    }

    private void apply(ConversationContext session, StateTracker ledger, Turn userTurn, BrainResponse response) {
        Map<String, Object> turnMetadata = new LinkedHashMap<>();
        turnMetadata.put("confidence", response.confidence());
        turnMetadata.put("latency_ms", response.latencyMs());
        turnMetadata.put("actions", response.actions());
        List<String> entityNames = response.entities().stream().map(DetectedEntity::name).toList();
        session.addBrainTurn(response.text(), response.intent(), entityNames, turnMetadata);

        for (DetectedEntity entity : response.entities()) {
            session.trackEntity(entity.name(), entity.type(), entity.aliases(), entity.metadata());
        }

        if (response.state() != null) {
            Map<String, Object> transitionMetadata = new LinkedHashMap<>();
            transitionMetadata.put("intent", response.intent());
            ledger.transition(response.state(), userTurn.id(), transitionMetadata);
        }
        if (response.summaryUpdate() != null) {
            session.updateSummary(response.summaryUpdate());
        }
        if (response.intent() != null) {
            session.pushTopic(response.intent());
        }
    }

    private BrainResponse withFallbackActions(String text, BrainResponse response) {
        if (fallbackDetector == null || !config.fallbackActionsEnabled() || !response.actions().isEmpty()) {
            return response;
        }
        try {
            List<SuggestedAction> detected = fallbackDetector.detectFallbackActions(text);
            if (detected == null || detected.isEmpty()) {
                return response;
            }
            LOG.info("Fallback action detected: {}", detected.get(0).action());
            return response.withActions(detected);
        } catch (RuntimeException e) {
            LOG.warn("Fallback action detection failed", e);
            return response;
        }
    }

    private BrainResponse recover(
        ConversationContext session,
        StateTracker ledger,
        Turn userTurn,
        String apology,
        Exception cause,
        long startedNanos
    ) {
        LOG.warn("Turn failed, answering with apology: {}", cause.getMessage());
        BrainResponse response = BrainResponse.error(apology, elapsedMs(startedNanos));
        session.addBrainTurn(apology, BrainResponse.ERROR_INTENT, List.of(), Map.of("error", cause.getClass().getSimpleName()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intent", BrainResponse.ERROR_INTENT);
        ledger.transition(ConversationState.ERROR_RECOVERY, userTurn == null ? null : userTurn.id(), metadata);
        for (ConversationListener listener : listeners) {
            try {
                listener.onError(cause);
            } catch (RuntimeException e) {
                LOG.warn("Error listener failed", e);
            }
        }
        return response;
    }

    private void dispatch(BrainResponse response) {
        for (ConversationListener listener : listeners) {
            try {
                listener.onResponse(response);
            } catch (RuntimeException e) {
                LOG.warn("Response listener failed", e);
            }
        }
        for (SuggestedAction action : response.actions()) {
            for (ConversationListener listener : listeners) {
                try {
                    listener.onAction(action);
                } catch (RuntimeException e) {
                    LOG.warn("Action listener failed for {}", action.action(), e);
                }
            }
        }
    }

    // Compression

    // counts the turns completed before the current utterance, which always come in user/brain pairs
    private void maybeCompress(ConversationContext session) {
        int completed = session.turnCount() - 1;
        if (completed <= 0
            || completed < config.autoCompressAt()
            || config.compressEvery() <= 0
            || completed % config.compressEvery() != 0) {
            return;
        }
        LOG.info("Requesting context compression after {} turns", completed);
        OutboundContext outbound = session.buildOutboundPayload(config.recentEntityLimit(), config.topicHistoryLimit());
        try {
            JsonNode raw = gateway.send(payloadBuilder.compression(outbound), config.compressTimeout());
            String summary = parser.summaryText(raw);
            if (!summary.isBlank()) {
                session.updateSummary(summary);
                LOG.info("Context compressed to {} chars", summary.length());
            }
        } catch (GatewayException e) {
            LOG.warn("Context compression failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Context compression failed", e);
        }
    }

    // Session

    public String newSession() {
        synchronized (turnLock) {
            String previous = context.sessionId();
            context = newContext();
            StateTracker ledger = new StateTracker(clock);
            stateListeners.forEach(ledger::onTransition);
            state = ledger;
            LOG.info("New session {} (replaced {})", context.sessionId(), previous);
            return context.sessionId();
        }
    }

    public String sessionId() {
        return context.sessionId();
    }

    public ConversationContext context() {
        return context;
    }

    public StateTracker stateTracker() {
        return state;
    }

    public EngineStatus status() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("context_window", config.contextWindowSize());
        settings.put("max_entities", config.maxEntities());
        settings.put("auto_compress_at", config.autoCompressAt());
        settings.put("response_timeout_ms", config.responseTimeoutMs());
        return new EngineStatus(context.describe(), state.describe(), gateway.healthReport(), settings);
    }

    private ConversationContext newContext() {
        return new ConversationContext(
            UUID.randomUUID().toString(),
            config.contextWindowSize(),
            config.maxEntities(),
            clock
        );
    }

    private static double elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
