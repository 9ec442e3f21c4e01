package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.service.GraphStore;

/**
 * One user's diagnostic conversation over a shared graph. Not thread-safe; the
 * underlying {@link GraphStore} is.
 */
public final class DiagnosticSession {

    private final ConversationEngine engine;
    private final GraphStore store;
    private final ConversationState state;

    DiagnosticSession(ConversationEngine engine, GraphStore store, ConversationState state) {
        this.engine = engine;
        this.store = store;
        this.state = state;
    }

    public String processTurn(String input) {
        return engine.process(store, state, input);
    }

    public String summary() {
        return engine.summary(store, state);
    }

    public StateSnapshot currentState() {
        return engine.currentState(state);
    }

    public void reset() {
        engine.reset(state);
    }

    public ConversationState state() {
        return state;
    }

    public GraphStore store() {
        return store;
    }
}
