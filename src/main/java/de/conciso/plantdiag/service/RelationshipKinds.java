package de.conciso.plantdiag.service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Relationship types the engine understands. Anything else stays in the graph
 * but is never followed.
 */
public final class RelationshipKinds {

    public static final Set<String> SYMPTOM_LINKS = Set.of("HAS_SYMPTOM", "MANIFESTS_AS", "SHOWS", "EXHIBITS");

    private static final List<String> SOLUTION_FRAGMENTS = List.of("solution", "treatment");
    private static final Set<String> SOLUTION_LINKS = Set.of("has_solution", "treated_by");

    private RelationshipKinds() {}

    public static boolean isSymptomLink(String type) {
        return type != null && SYMPTOM_LINKS.contains(type);
    }

    public static boolean isSolutionLink(String type) {
        if (type == null) return false;
        String lower = type.toLowerCase(Locale.ROOT);
        return SOLUTION_LINKS.contains(lower) || SOLUTION_FRAGMENTS.stream().anyMatch(lower::contains);
    }
}
