package de.conciso.plantdiag.service;

import de.conciso.plantdiag.model.DifferentiatorCandidate;
import de.conciso.plantdiag.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Picks the symptom whose presence or absence best splits the current top candidates.
 */
@Service
public class DifferentiatorSelector {

    private static final Logger log = LoggerFactory.getLogger(DifferentiatorSelector.class);

    public static final int MAX_DISEASES = 5;
    static final double FREQUENCY_BONUS = 0.1;

    private final SymptomMatcher matcher;
    private final DiseaseRanker ranker;

    public DifferentiatorSelector(SymptomMatcher matcher, DiseaseRanker ranker) {
        this.matcher = matcher;
        this.ranker = ranker;
    }

    /**
     * @param topDiseaseNames candidate disease names, only the first {@value #MAX_DISEASES} are used
     * @param excluded confirmed, ruled-out and already asked symptoms
     * @return the best question symptom, or empty if nothing discriminates any more
     */
    public Optional<String> select(GraphStore store, List<String> topDiseaseNames, Collection<String> excluded) {
        DifferentiatorCandidate best = null;
        for (DifferentiatorCandidate candidate : candidates(store, topDiseaseNames, excluded)) {
            if (candidate.score() > 0 && (best == null || candidate.score() > best.score())) {
                best = candidate;
            }
        }
        if (best == null) {
            log.debug("No differentiating symptom left for {}", topDiseaseNames);
            return Optional.empty();
        }
        log.debug("Best symptom to ask: '{}' (score {}, diseases {})", best.symptom(), best.score(), best.diseases());
        return Optional.of(best.symptom());
    }

    /** All scored candidate symptoms in symptom-name order. */
    public List<DifferentiatorCandidate> candidates(GraphStore store, List<String> topDiseaseNames,
                                                    Collection<String> excluded) {
        if (topDiseaseNames == null || topDiseaseNames.isEmpty()) return List.of();

        List<String> diseases = topDiseaseNames.stream().distinct().limit(MAX_DISEASES).toList();
        Set<String> exclusions = new LinkedHashSet<>();
        if (excluded != null) {
            excluded.stream().map(matcher::normalize).filter(s -> !s.isEmpty()).forEach(exclusions::add);
        }

        Map<String, Set<String>> diseasesBySymptom = new TreeMap<>();
        for (String diseaseName : diseases) {
            for (GraphNode disease : store.diseasesNamed(diseaseName)) {
                for (String symptom : ranker.canonicalSymptoms(store, disease)) {
                    if (exclusions.contains(symptom) || matcher.matchesAny(symptom, exclusions)) continue;
                    diseasesBySymptom.computeIfAbsent(symptom, k -> new TreeSet<>()).add(diseaseName);
                }
            }
        }

        List<DifferentiatorCandidate> out = new ArrayList<>(diseasesBySymptom.size());
        diseasesBySymptom.forEach((symptom, withIt) ->
                out.add(new DifferentiatorCandidate(symptom, Set.copyOf(withIt), score(withIt.size(), diseases.size()))));
        return out;
    }

    static double score(int with, int candidateCount) {
        int without = candidateCount - with;
        if (with <= 0 || without <= 0) return 0.0;
        return Math.min(with, without) + FREQUENCY_BONUS * with;
    }
}
