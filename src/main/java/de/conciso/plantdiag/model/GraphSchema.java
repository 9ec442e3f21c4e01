package de.conciso.plantdiag.model;

import java.util.List;

public record GraphSchema(
        List<String> nodeTypes,
        List<String> relationshipTypes,
        /** Knoten pro Typ, absteigend nach Anzahl. */
        List<TypeCount> nodeCounts
) {
    public record TypeCount(String type, int count) {}

    public boolean isEmpty() {
        return nodeTypes.isEmpty();
    }
}
