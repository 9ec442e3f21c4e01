package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.model.CandidateDisease;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything one diagnostic session knows. Owned by exactly one session and
 * mutated only by {@link ConversationEngine}; never share an instance between sessions.
 *
 * <p>Symptom sets keep insertion order, so the order in which evidence arrived is
 * visible in the diagnosis context and the transcript.</p>
 */
public class ConversationState {

    public record Exchange(String role, String text, int turn) {}

    private final Set<String> confirmed = new LinkedHashSet<>();
    private final Set<String> ruledOut = new LinkedHashSet<>();
    private final Set<String> asked = new LinkedHashSet<>();
    private final List<Exchange> history = new ArrayList<>();
    private List<CandidateDisease> candidateDiseases = List.of();
    private String lastAsked;
    private int turn;
    private Phase phase = Phase.COLLECTING;
    private String diagnosis;
    private String diagnosedDisease;

    public Set<String> getConfirmed() {
        return Collections.unmodifiableSet(confirmed);
    }

    public Set<String> getRuledOut() {
        return Collections.unmodifiableSet(ruledOut);
    }

    public Set<String> getAsked() {
        return Collections.unmodifiableSet(asked);
    }

    public List<CandidateDisease> getCandidateDiseases() {
        return candidateDiseases;
    }

    public String getLastAsked() {
        return lastAsked;
    }

    public int getTurn() {
        return turn;
    }

    public Phase getPhase() {
        return phase;
    }

    public String getDiagnosis() {
        return diagnosis;
    }

    public String getDiagnosedDisease() {
        return diagnosedDisease;
    }

    public List<Exchange> getHistory() {
        return Collections.unmodifiableList(history);
    }

    // --- mutation, engine only ---

    boolean confirm(String symptom) {
        return confirmed.add(symptom);
    }

    boolean ruleOut(String symptom) {
        return ruledOut.add(symptom);
    }

    void markAsked(String symptom) {
        lastAsked = symptom;
        asked.add(symptom);
    }

    /** confirmed ∪ ruled out ∪ asked */
    Set<String> exclusions() {
        Set<String> all = new LinkedHashSet<>(confirmed);
        all.addAll(ruledOut);
        all.addAll(asked);
        return all;
    }

    void candidateDiseases(List<CandidateDisease> candidates) {
        this.candidateDiseases = List.copyOf(candidates);
    }

    int nextTurn() {
        return ++turn;
    }

    void diagnosed(String diseaseName, String text) {
        this.phase = Phase.DIAGNOSED;
        this.diagnosedDisease = diseaseName;
        this.diagnosis = text;
    }

    void record(String role, String text) {
        history.add(new Exchange(role, text, turn));
    }

    void clear() {
        confirmed.clear();
        ruledOut.clear();
        asked.clear();
        history.clear();
        candidateDiseases = List.of();
        lastAsked = null;
        turn = 0;
        phase = Phase.COLLECTING;
        diagnosis = null;
        diagnosedDisease = null;
    }
}
