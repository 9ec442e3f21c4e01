package de.conciso.plantdiag.model;

import java.util.Set;

public record DifferentiatorCandidate(
        String symptom,
        Set<String> diseases,
        double score
) {}
