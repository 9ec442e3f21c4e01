package de.conciso.plantdiag.model;

public record GraphRelationship(
        String source,
        String target,
        String type
) {}
