package de.conciso.plantdiag.service;

import de.conciso.plantdiag.model.CandidateDisease;
import de.conciso.plantdiag.model.GraphNode;
import de.conciso.plantdiag.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores every disease of the graph by how many of the confirmed symptoms it explains.
 */
@Service
public class DiseaseRanker {

    private static final Logger log = LoggerFactory.getLogger(DiseaseRanker.class);

    public static final int MAX_RESULTS = 10;

    /** match_percentage desc, match_count desc, then name asc so equal scores rank reproducibly. */
    static final Comparator<CandidateDisease> RANKING =
            Comparator.comparingDouble(CandidateDisease::matchPercentage).reversed()
                    .thenComparing(Comparator.comparingInt(CandidateDisease::matchCount).reversed())
                    .thenComparing(CandidateDisease::name);

    private final SymptomMatcher matcher;

    public DiseaseRanker(SymptomMatcher matcher) {
        this.matcher = matcher;
    }

    public List<CandidateDisease> rank(GraphStore store, Collection<String> confirmedSymptoms) {
        if (confirmedSymptoms == null || confirmedSymptoms.isEmpty()) return List.of();

        Set<String> confirmed = new LinkedHashSet<>();
        for (String symptom : confirmedSymptoms) {
            String normalized = matcher.normalize(symptom);
            if (!normalized.isEmpty()) confirmed.add(normalized);
        }

        List<CandidateDisease> results = new ArrayList<>();
        for (GraphNode disease : store.nodesByKind(NodeKind.DISEASE)) {
            Set<String> diseaseSymptoms = canonicalSymptoms(store, disease);
            List<String> matched = new ArrayList<>();
            for (String userSymptom : confirmed) {
                // first unclaimed hit, so one disease symptom is never counted twice
                for (String diseaseSymptom : diseaseSymptoms) {
                    if (!matched.contains(diseaseSymptom) && matcher.matches(userSymptom, diseaseSymptom)) {
                        matched.add(diseaseSymptom);
                        break;
                    }
                }
            }
            if (!matched.isEmpty()) {
                results.add(CandidateDisease.of(disease.name(), disease.description(), diseaseSymptoms, matched));
            }
        }

        results.sort(RANKING);
        List<CandidateDisease> top = results.size() > MAX_RESULTS ? results.subList(0, MAX_RESULTS) : results;
        log.debug("Ranked {} disease(s) for {}: {}", top.size(), confirmed,
                top.stream().map(d -> d.name() + "=" + String.format("%.2f", d.matchPercentage())).toList());
        return List.copyOf(top);
    }

    /** Normalized, de-duplicated symptom names of a disease in name order. */
    public Set<String> canonicalSymptoms(GraphStore store, GraphNode disease) {
        Set<String> symptoms = new TreeSet<>();
        for (String name : store.symptomNamesOf(disease)) {
            String normalized = matcher.normalize(name);
            if (!normalized.isEmpty()) symptoms.add(normalized);
        }
        return symptoms;
    }
}
