package io.parley.core.engine;

import static io.parley.core.gateway.ScriptedBrainTransport.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.parley.core.config.model.EngineConfig;
import io.parley.core.config.model.GatewayConfig;
import io.parley.core.context.EntityType;
import io.parley.core.context.Role;
import io.parley.core.context.TrackedEntity;
import io.parley.core.context.Turn;
import io.parley.core.gateway.BrainErrorException;
import io.parley.core.gateway.BrainGateway;
import io.parley.core.gateway.ConnectionFailureException;
import io.parley.core.gateway.GatewayStatus;
import io.parley.core.gateway.ResponseTimeoutException;
import io.parley.core.gateway.ScriptedBrainTransport;
import io.parley.core.state.ConversationState;
import io.parley.core.state.StateSnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConversationEngineTest {
    private final ScriptedBrainTransport transport = new ScriptedBrainTransport();
    private ConversationEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void shouldFoldBrainAnswerIntoMemoryAndState() {
        engine = engine(engineConfig(20, 30, 10, 2_000, true));
        transport.respondWith(answer(frame -> Map.of(
            "response_text", "Got it. How did Marcus take the pricing?",
            "inferred_intent", "debrief_call",
            "inferred_state", "debriefing",
            "entities_detected", List.of(
                Map.of("name", "Marcus", "type", "person", "aliases", List.of("Marc"), "company", "Acme"),
                Map.of("name", "Acme", "type", "company")
            ),
            "suggested_actions", List.of(Map.of("action", "log_call", "params", Map.of("account", "Acme"))),
            "follow_up_prompt", "Want me to log it?",
            "confidence", 0.9,
            "context_summary_update", "Debriefing a call with Marcus from Acme."
        )));
        RecordingListener listener = new RecordingListener();
        engine.addListener(listener);

        BrainResponse response = engine.process("Just got off the phone with Marcus from Acme");

        assertThat(response.text()).isEqualTo("Got it. How did Marcus take the pricing?");
        assertThat(response.state()).isEqualTo(ConversationState.DEBRIEFING);
        assertThat(response.isError()).isFalse();

        List<Turn> turns = engine.context().allTurns();
        assertThat(turns).extracting(Turn::role).containsExactly(Role.USER, Role.BRAIN);
        Turn brainTurn = turns.get(1);
        assertThat(brainTurn.intent()).isEqualTo("debrief_call");
        assertThat(brainTurn.entities()).containsExactly("Marcus", "Acme");
        assertThat(brainTurn.metadata()).containsEntry("confidence", 0.9).containsKeys("latency_ms", "actions");

        TrackedEntity marcus = engine.context().findEntity("marc").orElseThrow();
        assertThat(marcus.type()).isEqualTo(EntityType.PERSON);
        assertThat(marcus.metadata()).containsEntry("company", "Acme");

        StateSnapshot current = engine.stateTracker().currentSnapshot();
        assertThat(current.state()).isEqualTo(ConversationState.DEBRIEFING);
        assertThat(current.triggerTurnId()).isEqualTo(turns.get(0).id());
        assertThat(current.metadata()).containsEntry("intent", "debrief_call");

        assertThat(engine.context().summary()).isEqualTo("Debriefing a call with Marcus from Acme.");
        assertThat(engine.context().currentTopic()).contains("debrief_call");
        assertThat(listener.responses).containsExactly(response);
        assertThat(listener.actions).extracting(SuggestedAction::action).containsExactly("log_call");
        assertThat(listener.errors).isEmpty();
        assertThat(engine.isProcessing()).isFalse();
    }

    @Test
    void shouldSendOnlyTheRollingWindowWithEachUtterance() {
        engine = engine(engineConfig(4, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of("response_text", "ok")));

        engine.process("one");
        engine.process("two");
        engine.process("three");

        JsonNode frame = transport.lastSent();
        assertThat(frame.path("type").asText()).isEqualTo("conversation");
        assertThat(frame.path("user_message").asText()).isEqualTo("three");
        assertThat(frame.path("system_prompt").asText()).isEqualTo(BrainPayloadBuilder.DEFAULT_SYSTEM_PROMPT);
        JsonNode context = frame.path("context");
        assertThat(context.path("turn_count").asInt()).isEqualTo(5);
        assertThat(context.path("turns")).hasSize(4);
        assertThat(context.path("turns").get(3).path("content").asText()).isEqualTo("three");
        assertThat(context.path("session_id").asText()).isEqualTo(engine.sessionId());
        assertThat(engine.context().allTurns()).hasSize(6);
    }

    @Test
    void shouldAttachUserProfileWhenSet() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of("response_text", "ok")));

        engine.process("first");
        assertThat(transport.lastSent().has("user_profile")).isFalse();

        engine.setUserProfile(Map.of("name", "Dana", "territory", "EMEA"));
        engine.process("second");

        assertThat(transport.lastSent().path("user_profile").path("territory").asText()).isEqualTo("EMEA");
    }

    @Test
    void shouldApologizeWhenBrainTimesOut() {
        engine = engine(engineConfig(20, 30, 10, 100, true));
        RecordingListener listener = new RecordingListener();
        engine.addListener(listener);

        BrainResponse response = engine.process("Are you there?");

        assertThat(response.isError()).isTrue();
        assertThat(response.text()).isEqualTo(ConversationEngine.TIMEOUT_APOLOGY);
        assertThat(response.intent()).isEqualTo("error");
        assertThat(response.confidence()).isZero();
        assertThat(engine.stateTracker().currentState()).isEqualTo(ConversationState.ERROR_RECOVERY);
        Turn last = lastTurn();
        assertThat(last.role()).isEqualTo(Role.BRAIN);
        assertThat(last.intent()).isEqualTo("error");
        assertThat(listener.errors).singleElement().isInstanceOf(ResponseTimeoutException.class);
        assertThat(listener.responses).isEmpty();
    }

    @Test
    void shouldApologizeWhenBrainIsUnreachable() {
        engine = engine(engineConfig(20, 30, 10, 2_000, true));
        transport.failOpens(true);
        RecordingListener listener = new RecordingListener();
        engine.addListener(listener);

        BrainResponse response = engine.process("hello?");

        assertThat(response.text()).isEqualTo(ConversationEngine.CONNECTION_APOLOGY);
        assertThat(response.state()).isEqualTo(ConversationState.ERROR_RECOVERY);
        assertThat(engine.isStarted()).isFalse();
        assertThat(engine.context().allTurns()).extracting(Turn::role).containsExactly(Role.USER, Role.BRAIN);
        assertThat(listener.errors).singleElement().isInstanceOf(ConnectionFailureException.class);
    }

    @Test
    void shouldApologizeWhenBrainReportsError() {
        engine = engine(engineConfig(20, 30, 10, 2_000, true));
        transport.respondWith(frame -> List.of(json(Map.of(
            "request_id", frame.path("request_id").asText(),
            "error", "rate limited"
        ))));
        RecordingListener listener = new RecordingListener();
        engine.addListener(listener);

        BrainResponse response = engine.process("hello");

        assertThat(response.text()).isEqualTo(ConversationEngine.GENERIC_APOLOGY);
        assertThat(listener.errors).singleElement().isInstanceOf(BrainErrorException.class);
    }

    @Test
    void shouldKeepGoingWhenListenerThrows() {
        engine = engine(engineConfig(20, 30, 10, 2_000, true));
        transport.respondWith(answer(frame -> Map.of(
            "response_text", "done",
            "suggested_actions", List.of("check_calendar")
        )));
        engine.addListener(new ConversationListener() {
            @Override
            public void onResponse(BrainResponse response) {
                throw new IllegalStateException("listener broke");
            }

            @Override
            public void onAction(SuggestedAction action) {
                throw new IllegalStateException("listener broke");
            }
        });
        RecordingListener listener = new RecordingListener();
        engine.addListener(listener);

        BrainResponse response = engine.process("what's on my calendar");

        assertThat(response.text()).isEqualTo("done");
        assertThat(listener.responses).hasSize(1);
        assertThat(listener.actions).extracting(SuggestedAction::action).containsExactly("check_calendar");
    }

    @Test
    void shouldUseFallbackActionsOnlyWhenBrainSuggestsNone() {
        engine = engine(engineConfig(20, 30, 10, 2_000, true));
        transport.respondWith(answer(frame -> Map.of("response_text", "Let me check.")));

        BrainResponse response = engine.process("How's my pipeline?");

        assertThat(response.actions()).extracting(SuggestedAction::action).containsExactly("get_pipeline");
    }

    @Test
    void shouldSkipFallbackActionsWhenDisabled() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of("response_text", "Let me check.")));

        BrainResponse response = engine.process("How's my pipeline?");

        assertThat(response.actions()).isEmpty();
    }

    @Test
    void shouldCompressContextOnceThresholdIsReached() {
        engine = engine(engineConfig(20, 4, 2, 2_000, false));
        List<String> types = new CopyOnWriteArrayList<>();
        transport.respondWith(frame -> {
            String type = frame.path("type").asText();
            types.add(type);
            String id = frame.path("request_id").asText();
            if (BrainPayloadBuilder.COMPRESS_MESSAGE_TYPE.equals(type)) {
                return List.of(json(Map.of("request_id", id, "content", "Compressed summary.")));
            }
            return List.of(json(Map.of("request_id", id, "content", Map.of("response_text", "ok"))));
        });

        engine.process("one");
        engine.process("two");
        assertThat(types).containsExactly("conversation", "conversation");

        engine.process("three");

        assertThat(types).containsExactly("conversation", "conversation", "context_compress", "conversation");
        assertThat(engine.context().summary()).isEqualTo("Compressed summary.");
        assertThat(transport.lastSent().path("context").path("session_summary").asText()).isEqualTo("Compressed summary.");
    }

    @Test
    void shouldSwallowCompressionFailure() {
        engine = engine(engineConfig(20, 2, 2, 2_000, false));
        transport.respondWith(frame -> {
            String id = frame.path("request_id").asText();
            if (BrainPayloadBuilder.COMPRESS_MESSAGE_TYPE.equals(frame.path("type").asText())) {
                return List.of(json(Map.of("request_id", id, "error", "cannot summarize")));
            }
            return List.of(json(Map.of("request_id", id, "content", Map.of("response_text", "fine"))));
        });

        engine.process("one");
        BrainResponse response = engine.process("two");

        assertThat(response.text()).isEqualTo("fine");
        assertThat(engine.context().summary()).isEmpty();
    }

    @Test
    void shouldStreamPartialTextToSink() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(frame -> {
            String id = frame.path("request_id").asText();
            return List.of(
                json(Map.of("type", "stream_chunk", "request_id", id, "content", "Hello ")),
                json(Map.of("type", "stream_chunk", "request_id", id, "content", "there")),
                json(Map.of("type", "stream_end", "request_id", id, "content", Map.of("response_text", "Hello there")))
            );
        });
        List<String> chunks = new ArrayList<>();

        BrainResponse response = engine.process("hi", Map.of("source", "voice"), chunks::add);

        assertThat(chunks).containsExactly("Hello ", "there");
        assertThat(response.text()).isEqualTo("Hello there");
        assertThat(engine.context().allTurns().get(0).metadata()).containsEntry("source", "voice");
    }

    @Test
    void shouldUseStreamedTextWhenStreamEndCarriesNoContent() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(frame -> {
            String id = frame.path("request_id").asText();
            return List.of(
                json(Map.of("type", "stream_chunk", "request_id", id, "content", "Hello ")),
                json(Map.of("type", "stream_chunk", "request_id", id, "content", "there")),
                json(Map.of("type", "stream_end", "request_id", id)),
                json(Map.of("request_id", id, "content", Map.of("response_text", "late", "inferred_state", "greeting")))
            );
        });
        List<String> chunks = new ArrayList<>();

        BrainResponse response = engine.process("hi", Map.of(), chunks::add);

        assertThat(chunks).containsExactly("Hello ", "there");
        assertThat(response.text()).isEqualTo("Hello there");
        assertThat(lastTurn().content()).isEqualTo("Hello there");
        assertThat(engine.stateTracker().currentState()).isEqualTo(ConversationState.IDLE);
    }

    @Test
    void shouldStartFreshSessionAndKeepStateListeners() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of(
            "response_text", "Hi!",
            "inferred_state", "greeting",
            "entities_detected", List.of(Map.of("name", "Dana", "type", "person"))
        )));
        List<ConversationState> transitions = new CopyOnWriteArrayList<>();
        engine.onStateTransition((previous, current) -> transitions.add(current.state()));
        engine.process("hello");
        String firstSession = engine.sessionId();

        String secondSession = engine.newSession();

        assertThat(secondSession).isNotEqualTo(firstSession).isEqualTo(engine.sessionId());
        assertThat(engine.context().turnCount()).isZero();
        assertThat(engine.context().entityCount()).isZero();
        assertThat(engine.stateTracker().currentState()).isEqualTo(ConversationState.IDLE);

        engine.process("hello again");
        assertThat(transitions).containsExactly(ConversationState.GREETING, ConversationState.GREETING);
        assertThat(transport.lastSent().path("context").path("session_id").asText()).isEqualTo(secondSession);
    }

    @Test
    void shouldReportStatus() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of("response_text", "ok", "inferred_state", "querying")));
        engine.process("status check");

        EngineStatus status = engine.status();

        assertThat(status.session().turnCount()).isEqualTo(2);
        assertThat(status.state().currentState()).isEqualTo(ConversationState.QUERYING);
        assertThat(status.gateway().status()).isEqualTo(GatewayStatus.CONNECTED);
        assertThat(status.config()).containsEntry("context_window", 20);
    }

    @Test
    void shouldStopAndRestartOnNextUtterance() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of("response_text", "ok")));
        engine.process("first");

        engine.stop();
        assertThat(engine.isStarted()).isFalse();

        BrainResponse response = engine.process("second");
        assertThat(response.text()).isEqualTo("ok");
        assertThat(transport.opens()).isEqualTo(2);
    }

    @Test
    void shouldNotReopenConnectionAfterClose() {
        engine = engine(engineConfig(20, 30, 10, 2_000, false));
        transport.respondWith(answer(frame -> Map.of("response_text", "ok")));
        engine.process("first");
        engine.close();

        BrainResponse response = engine.process("second");

        assertThat(response.text()).isEqualTo(ConversationEngine.CONNECTION_APOLOGY);
        assertThat(transport.opens()).isEqualTo(1);
    }

    private ConversationEngine engine(EngineConfig config) {
        GatewayConfig gatewayConfig = new GatewayConfig("ws://brain.test/ws", 1_000, 10, 40, 3, 0, 60_000, 2_000, 1024 * 1024);
        BrainGateway gateway = new BrainGateway(gatewayConfig, transport, Clock.systemUTC());
        return new ConversationEngine(config, gateway, new PatternFallbackActionDetector(), Clock.systemUTC());
    }

    private static EngineConfig engineConfig(
        int window,
        int autoCompressAt,
        int compressEvery,
        long responseTimeoutMs,
        boolean fallbackActions
    ) {
        return new EngineConfig(window, 200, 15, 5, autoCompressAt, compressEvery, responseTimeoutMs, 1_000, null, fallbackActions);
    }

    private static Function<JsonNode, List<String>> answer(Function<JsonNode, Map<String, Object>> content) {
        return frame -> List.of(json(Map.of(
            "request_id", frame.path("request_id").asText(),
            "content", content.apply(frame)
        )));
    }

    private Turn lastTurn() {
        List<Turn> turns = engine.context().allTurns();
        return turns.get(turns.size() - 1);
    }

    private static final class RecordingListener implements ConversationListener {
        private final List<BrainResponse> responses = new CopyOnWriteArrayList<>();
        private final List<SuggestedAction> actions = new CopyOnWriteArrayList<>();
        private final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onResponse(BrainResponse response) {
            responses.add(response);
        }

        @Override
        public void onAction(SuggestedAction action) {
            actions.add(action);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }
    }
}
