package de.conciso.plantdiag.model;

public record HealthStatus(boolean available, String message) {}
