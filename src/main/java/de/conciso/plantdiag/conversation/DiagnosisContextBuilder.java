package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.model.CandidateDisease;
import de.conciso.plantdiag.model.Solution;
import de.conciso.plantdiag.service.GraphStore;
import de.conciso.plantdiag.service.SolutionLookup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flattens the evidence behind a diagnosis into the context string handed to text generation.
 */
@Component
public class DiagnosisContextBuilder {

    static final String SEPARATOR = " | ";
    static final String NO_SOLUTIONS = "NO SPECIFIC SOLUTIONS FOUND IN GRAPH";

    private final SolutionLookup solutionLookup;

    public DiagnosisContextBuilder(SolutionLookup solutionLookup) {
        this.solutionLookup = solutionLookup;
    }

    public String build(GraphStore store, ConversationState state, CandidateDisease disease, String note) {
        List<String> parts = new ArrayList<>();
        parts.add("CONFIRMED symptoms: " + List.copyOf(state.getConfirmed()));
        parts.add("RULED OUT symptoms: " + List.copyOf(state.getRuledOut()));
        parts.add("DIAGNOSED disease: " + disease.name() + " (" + percent(disease.matchPercentage()) + " match)");
        parts.add("MATCHED symptoms: " + disease.matchedSymptoms());
        if (note != null && !note.isBlank()) {
            parts.add(note);
        }

        List<Solution> solutions = solutionLookup.solutionsFor(store, disease.name());
        if (solutions.isEmpty()) {
            parts.add(NO_SOLUTIONS);
        } else {
            parts.add("AVAILABLE SOLUTIONS: " + solutions.stream().map(Solution::name).toList());
            for (Solution solution : solutions) {
                if (!solution.description().isBlank()) {
                    parts.add("SOLUTION - " + solution.name() + ": " + solution.description());
                }
                parts.add("TREATMENT - " + solution.name() + ": " + solution.treatment());
            }
        }
        return String.join(SEPARATOR, parts);
    }

    static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }
}
