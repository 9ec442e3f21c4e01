package de.conciso.plantdiag.conversation;

public enum Phase {
    /** Evidence is still being collected; each turn may end in a question. */
    COLLECTING,
    /** Terminal until the session is reset. */
    DIAGNOSED
}
