package de.conciso.plantdiag.conversation;

/**
 * How a diagnosis is presented: the headline shown to the user and the note
 * passed to text generation as part of the context.
 */
enum Framing {
    IMMEDIATE("IMMEDIATE DIAGNOSIS!", "IMMEDIATE DIAGNOSIS"),
    COMPLETE("DIAGNOSIS COMPLETE!", "DIAGNOSIS after %d symptoms confirmed"),
    ANALYSIS_COMPLETE("DIAGNOSIS (Analysis Complete)!", "ANALYSIS COMPLETE - Sufficient symptoms"),
    FINAL("FINAL DIAGNOSIS!", "NO MORE QUESTIONS - Final diagnosis"),
    SUMMARY("", "SUMMARY ANALYSIS");

    private final String headline;
    private final String note;

    Framing(String headline, String note) {
        this.headline = headline;
        this.note = note;
    }

    String note(int confirmedCount) {
        return String.format(note, confirmedCount);
    }

    String present(String text) {
        return headline.isEmpty() ? text : headline + "\n\n" + text;
    }

    static Framing of(StopReason reason, boolean firstTurn) {
        return switch (reason) {
            case SUFFICIENT_EVIDENCE -> ANALYSIS_COMPLETE;
            case NO_MORE_QUESTIONS -> FINAL;
            default -> firstTurn ? IMMEDIATE : COMPLETE;
        };
    }
}
