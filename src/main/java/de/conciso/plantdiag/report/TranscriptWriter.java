package de.conciso.plantdiag.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.plantdiag.conversation.ConversationState;
import de.conciso.plantdiag.conversation.DiagnosticSession;
import de.conciso.plantdiag.model.CandidateDisease;
import de.conciso.plantdiag.service.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schreibt den Verlauf einer Sitzung als JSON: Graph-Kennzahlen, Evidenz,
 * Kandidaten und alle Nachrichten in Reihenfolge.
 */
@Component
public class TranscriptWriter {

    private static final Logger log = LoggerFactory.getLogger(TranscriptWriter.class);

    private final ObjectMapper objectMapper;

    public TranscriptWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(DiagnosticSession session, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), toMap(session));
        log.info("Transcript written: {}", path);
    }

    Map<String, Object> toMap(DiagnosticSession session) {
        ConversationState state = session.state();
        GraphStore store = session.store();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", Instant.now().toString());

        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("nodes", store.nodeCount());
        graph.put("relationships", store.relationshipCount());
        json.put("graph", graph);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("phase", state.getPhase().name());
        evidence.put("turns", state.getTurn());
        evidence.put("confirmed", List.copyOf(state.getConfirmed()));
        evidence.put("ruledOut", List.copyOf(state.getRuledOut()));
        evidence.put("asked", List.copyOf(state.getAsked()));
        evidence.put("diagnosedDisease", state.getDiagnosedDisease());
        json.put("evidence", evidence);

        json.put("candidates", state.getCandidateDiseases().stream().map(this::candidateToMap).toList());
        json.put("history", state.getHistory());
        return json;
    }

    private Map<String, Object> candidateToMap(CandidateDisease d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", d.name());
        m.put("matchedSymptoms", d.matchedSymptoms());
        m.put("matchCount", d.matchCount());
        m.put("totalSymptoms", d.totalSymptoms());
        m.put("matchPercentage", r(d.matchPercentage()));
        return m;
    }

    private double r(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
