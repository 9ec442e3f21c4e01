package de.conciso.plantdiag.model;

public record Solution(
        String name,
        String description,
        String treatment
) {}
