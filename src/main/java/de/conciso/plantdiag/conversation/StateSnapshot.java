package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.model.CandidateDisease;

import java.util.List;

/** Immutable copy of a session's evidence, as returned by {@code currentState()}. */
public record StateSnapshot(
        Phase phase,
        int turn,
        List<String> confirmed,
        List<String> ruledOut,
        List<String> asked,
        List<CandidateDisease> candidateDiseases
) {
    static StateSnapshot of(ConversationState state) {
        return new StateSnapshot(state.getPhase(), state.getTurn(),
                List.copyOf(state.getConfirmed()), List.copyOf(state.getRuledOut()),
                List.copyOf(state.getAsked()), state.getCandidateDiseases());
    }
}
