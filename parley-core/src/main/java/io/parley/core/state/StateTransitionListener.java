package io.parley.core.state;

@FunctionalInterface
public interface StateTransitionListener {
    void onTransition(StateSnapshot previous, StateSnapshot current);
}
