package de.conciso.plantdiag.model;

import java.util.List;
import java.util.Set;

/**
 * A disease scored against the confirmed symptoms of a session.
 * Always built from scratch by the ranker, never updated.
 */
public record CandidateDisease(
        String name,
        String description,
        Set<String> allSymptoms,
        List<String> matchedSymptoms,
        int matchCount,
        int totalSymptoms,
        double matchPercentage
) {
    public static CandidateDisease of(String name, String description,
                                      Set<String> allSymptoms, List<String> matchedSymptoms) {
        int total = Math.max(allSymptoms.size(), 1);
        return new CandidateDisease(name, description, Set.copyOf(allSymptoms), List.copyOf(matchedSymptoms),
                matchedSymptoms.size(), total, (double) matchedSymptoms.size() / total);
    }
}
