package de.conciso.plantdiag.runner;

import de.conciso.plantdiag.TestGraphs;
import de.conciso.plantdiag.api.TextGenerator;
import de.conciso.plantdiag.conversation.ConversationEngine;
import de.conciso.plantdiag.conversation.DiagnosticSession;
import de.conciso.plantdiag.conversation.Phase;
import de.conciso.plantdiag.model.HealthStatus;
import de.conciso.plantdiag.report.TranscriptWriter;
import de.conciso.plantdiag.service.GraphLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DiagnosticRunnerTest {

    private ConversationEngine engine;
    private DiagnosticRunner runner;

    @BeforeEach
    void setUp() {
        TextGenerator generator = mock(TextGenerator.class);
        when(generator.generate(anyList(), anyString())).thenReturn("Iron chelate helps.");
        when(generator.healthCheck()).thenReturn(new HealthStatus(true, "gemma3n:e4b available"));
        engine = TestGraphs.engine(generator);
        runner = new DiagnosticRunner(mock(GraphLoader.class), engine, generator, new TranscriptWriter(), "");
    }

    @Test
    void commandsAndTurnsAreHandled() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String output = run(session, "yellowing leaves\nstate\nno\nreset\nsummary\nquit\nbrown spots\n");

        assertThat(output)
                .contains("Plant Pathologist: Do you observe stunted growth on the plant?")
                .contains("Confirmed : [yellowing leaves]")
                .contains("Asked     : [stunted growth]")
                .contains("Plant Pathologist: Do you observe white powdery coating on the plant?")
                .contains("Conversation reset.")
                .contains("No symptoms confirmed yet.")
                .contains("Goodbye!")
                .doesNotContain("brown spots");
        assertThat(session.state().getTurn()).isZero();
    }

    @Test
    void conversationRunsToDiagnosis() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String output = run(session, "yellowing leaves\n\nyes\nexit\n");

        assertThat(output).contains("Plant Pathologist: DIAGNOSIS COMPLETE!")
                .contains("Iron chelate helps.");
        assertThat(session.state().getPhase()).isEqualTo(Phase.DIAGNOSED);
    }

    @Test
    void endOfInputEndsTheLoop() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String output = run(session, "brown spots");

        assertThat(output).contains("FINAL DIAGNOSIS!").doesNotContain("Goodbye!");
    }

    private String run(DiagnosticSession session, String input) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        runner.converse(session, new Scanner(new StringReader(input)), out);
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
