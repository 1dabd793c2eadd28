package io.parley.core.engine;

public interface ConversationListener {

    default void onResponse(BrainResponse response) {
    }

    default void onAction(SuggestedAction action) {
    }

    default void onError(Throwable error) {
    }
}
