package de.conciso.plantdiag.service;

import de.conciso.plantdiag.model.GraphNode;
import de.conciso.plantdiag.model.NodeKind;
import de.conciso.plantdiag.model.Solution;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

@Service
public class SolutionLookup {

    /**
     * Solutions linked to the disease with exactly this name; empty if the disease
     * is unknown or has no solution edge.
     */
    public List<Solution> solutionsFor(GraphStore store, String diseaseName) {
        return store.diseasesNamed(diseaseName).stream()
                .findFirst()
                .map(disease -> store.linkedNodes(disease, RelationshipKinds::isSolutionLink, NodeKind.SOLUTION))
                .orElse(List.of())
                .stream()
                .map(SolutionLookup::toSolution)
                .toList();
    }

    private static Solution toSolution(GraphNode node) {
        // treatment -> content -> instructions -> name
        String treatment = Stream.of(node.property("treatment"), node.property("content"), node.property("instructions"))
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(node.name());
        return new Solution(node.name(), node.description(), treatment);
    }
}
