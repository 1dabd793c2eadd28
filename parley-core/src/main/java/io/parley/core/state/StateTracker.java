package io.parley.core.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class StateTracker {
    public static final int MAX_HISTORY = 500;
    private static final int RECENT_STATES = 10;

    private static final Logger LOG = LoggerFactory.getLogger(StateTracker.class);

    private static final Set<ConversationState> AFTER_FAREWELL = EnumSet.of(
        ConversationState.IDLE,
        ConversationState.GREETING,
        ConversationState.FAREWELL,
        ConversationState.ERROR_RECOVERY
    );

    private final Clock clock;
    private final Deque<StateSnapshot> history = new ArrayDeque<>();
    private final List<StateTransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    private int totalTransitions;

    public StateTracker() {
        this(Clock.systemUTC());
    }

    public StateTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        history.addLast(new StateSnapshot(ConversationState.IDLE, clock.instant(), null, null, Map.of()));
    }

    public void onTransition(StateTransitionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(StateTransitionListener listener) {
        listeners.remove(listener);
    }

    public StateSnapshot transition(ConversationState state, String triggerTurnId, Map<String, Object> metadata) {
        Objects.requireNonNull(state, "state must not be null");
        StateSnapshot previous;
        StateSnapshot current;
        synchronized (lock) {
            Instant now = clock.instant();
            StateSnapshot open = history.pollLast();
            previous = open.close(now);
            current = new StateSnapshot(state, now, null, triggerTurnId, metadata);
            history.addLast(previous);
            history.addLast(current);
            while (history.size() > MAX_HISTORY) {
                history.pollFirst();
            }
            totalTransitions++;
        }

        if (isAnomalous(previous.state(), state)) {
            LOG.debug("Unusual state sequence {} -> {}", previous.state().wireValue(), state.wireValue());
        }
        for (StateTransitionListener listener : listeners) {
            try {
                listener.onTransition(previous, current);
            } catch (RuntimeException e) {
                LOG.warn("State listener failed on {} -> {}", previous.state().wireValue(), state.wireValue(), e);
            }
        }
        return current;
    }

    public ConversationState currentState() {
        return currentSnapshot().state();
    }

    public StateSnapshot currentSnapshot() {
        synchronized (lock) {
            return history.peekLast();
        }
    }

    public Duration timeInCurrentState() {
        return currentSnapshot().duration(clock);
    }

    public List<ConversationState> lastNStates(int n) {
        List<StateSnapshot> snapshots = history();
        int from = Math.max(0, snapshots.size() - Math.max(0, n));
        return snapshots.subList(from, snapshots.size()).stream()
            .map(StateSnapshot::state)
            .toList();
    }

    public List<StateSnapshot> history() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    public int totalTransitions() {
        synchronized (lock) {
            return totalTransitions;
        }
    }

    public StateInfo describe() {
        StateSnapshot current;
        int transitions;
        synchronized (lock) {
            current = history.peekLast();
            transitions = totalTransitions;
        }
        return new StateInfo(
            current.state(),
            current.enteredAt(),
            current.duration(clock).toMillis() / 1000.0,
            transitions,
            lastNStates(RECENT_STATES)
        );
    }

    private static boolean isAnomalous(ConversationState from, ConversationState to) {
        return from == ConversationState.FAREWELL && !AFTER_FAREWELL.contains(to);
    }
}
