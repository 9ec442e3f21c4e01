package de.conciso.plantdiag.runner;

import de.conciso.plantdiag.api.TextGenerator;
import de.conciso.plantdiag.conversation.ConversationEngine;
import de.conciso.plantdiag.conversation.DiagnosticSession;
import de.conciso.plantdiag.conversation.StateSnapshot;
import de.conciso.plantdiag.model.CandidateDisease;
import de.conciso.plantdiag.model.GraphSchema;
import de.conciso.plantdiag.model.HealthStatus;
import de.conciso.plantdiag.report.TranscriptWriter;
import de.conciso.plantdiag.service.GraphLoader;
import de.conciso.plantdiag.service.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Scanner;

@Component
@ConditionalOnProperty(name = "diagnostic.mode", havingValue = "interactive", matchIfMissing = true)
public class DiagnosticRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticRunner.class);

    private final GraphLoader graphLoader;
    private final ConversationEngine engine;
    private final TextGenerator textGenerator;
    private final TranscriptWriter transcriptWriter;
    private final String transcriptPath;

    public DiagnosticRunner(GraphLoader graphLoader,
                            ConversationEngine engine,
                            TextGenerator textGenerator,
                            TranscriptWriter transcriptWriter,
                            @Value("${diagnostic.transcript.path:}") String transcriptPath) {
        this.graphLoader = graphLoader;
        this.engine = engine;
        this.textGenerator = textGenerator;
        this.transcriptWriter = transcriptWriter;
        this.transcriptPath = transcriptPath;
    }

    @Override
    public void run(String... args) throws Exception {
        GraphStore store = graphLoader.load();
        PrintStream out = System.out;

        out.println();
        out.println("=== Plant Disease Diagnostic Assistant ===");
        printSchema(store.schema(), out);

        HealthStatus health = textGenerator.healthCheck();
        out.println("Text generation: " + health.message());
        if (!health.available()) {
            log.warn("Text generation unavailable, diagnoses will carry an error note: {}", health.message());
        }
        out.println("Commands: 'summary', 'state', 'reset', 'quit'");
        out.println();

        DiagnosticSession session = engine.openSession(store);
        try (Scanner in = new Scanner(System.in)) {
            converse(session, in, out);
        }
        writeTranscript(session);
    }

    /** Reads lines until EOF or quit; every non-command line is one turn. */
    void converse(DiagnosticSession session, Scanner in, PrintStream out) {
        while (true) {
            out.print("You: ");
            if (!in.hasNextLine()) break;
            String line = in.nextLine().trim();
            if (line.isEmpty()) continue;

            switch (line.toLowerCase(Locale.ROOT)) {
                case "quit", "exit" -> {
                    out.println("Goodbye!");
                    return;
                }
                case "summary" -> {
                    String sep = "=".repeat(40);
                    out.println(sep);
                    out.println(session.summary());
                    out.println(sep);
                }
                case "state" -> printState(session.currentState(), out);
                case "reset" -> {
                    session.reset();
                    out.println("Conversation reset.");
                }
                default -> {
                    out.println();
                    out.println("Plant Pathologist: " + session.processTurn(line));
                    out.println();
                }
            }
        }
    }

    // -------------------------------------------------------------------------

    private void printSchema(GraphSchema schema, PrintStream out) {
        if (schema.isEmpty()) {
            out.println("Graph is empty.");
            return;
        }
        out.printf("Graph loaded: %d node type(s), %d relationship type(s)%n",
                schema.nodeTypes().size(), schema.relationshipTypes().size());
        schema.nodeCounts().stream()
                .limit(3)
                .forEach(c -> out.printf("   - %s: %d nodes%n", c.type(), c.count()));
    }

    private void printState(StateSnapshot state, PrintStream out) {
        out.println("Phase     : " + state.phase());
        out.println("Confirmed : " + state.confirmed());
        out.println("Ruled out : " + state.ruledOut());
        out.println("Asked     : " + state.asked());
        out.println("Diseases  : " + state.candidateDiseases().size());
        for (CandidateDisease d : state.candidateDiseases().stream().limit(3).toList()) {
            out.printf(Locale.ROOT, "  - %s (%.1f%%)%n", d.name(), d.matchPercentage() * 100.0);
        }
    }

    private void writeTranscript(DiagnosticSession session) {
        if (transcriptPath == null || transcriptPath.isBlank()) return;
        try {
            transcriptWriter.write(session, Path.of(transcriptPath));
        } catch (IOException e) {
            log.error("Failed to write transcript", e);
        }
    }
}
