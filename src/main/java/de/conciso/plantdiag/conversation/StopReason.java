package de.conciso.plantdiag.conversation;

/** Why a session committed to a diagnosis. */
public enum StopReason {
    SINGLE_CANDIDATE,
    CLEAR_LEADER,
    HIGH_CONFIDENCE,
    SUFFICIENT_EVIDENCE,
    NO_MORE_QUESTIONS
}
