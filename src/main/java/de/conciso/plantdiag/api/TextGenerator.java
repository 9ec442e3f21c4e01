package de.conciso.plantdiag.api;

import de.conciso.plantdiag.model.HealthStatus;

import java.util.List;

/**
 * Narrative text generation for a finished diagnosis.
 * Implementations report failures in the returned text and never throw.
 */
public interface TextGenerator {

    String generate(List<String> symptoms, String context);

    HealthStatus healthCheck();
}
