package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.TestGraphs;
import de.conciso.plantdiag.api.TextGenerator;
import de.conciso.plantdiag.service.GraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationEngineTest {

    private TextGenerator generator;
    private ConversationEngine engine;

    @BeforeEach
    void setUp() {
        generator = mock(TextGenerator.class);
        when(generator.generate(anyList(), anyString())).thenReturn("narrative");
        engine = TestGraphs.engine(generator);
    }

    @Test
    void singleMatchingDiseaseIsDiagnosedOnFirstTurn() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String response = session.processTurn("brown spots");

        assertThat(response).isEqualTo("FINAL DIAGNOSIS!\n\nnarrative");
        assertThat(session.state().getPhase()).isEqualTo(Phase.DIAGNOSED);
        assertThat(session.state().getDiagnosedDisease()).isEqualTo("Bacterial Leaf Spot");
        assertThat(session.state().getTurn()).isEqualTo(1);
    }

    @Test
    void tiedCandidatesLeadToDiscriminatingQuestion() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String response = session.processTurn("Yellowing leaves.");

        assertThat(response).isEqualTo("Do you observe stunted growth on the plant?");
        StateSnapshot snapshot = session.currentState();
        assertThat(snapshot.phase()).isEqualTo(Phase.COLLECTING);
        assertThat(snapshot.confirmed()).containsExactly("yellowing leaves");
        assertThat(snapshot.asked()).containsExactly("stunted growth");
        assertThat(snapshot.candidateDiseases()).extracting(c -> c.name())
                .containsExactly("Iron Chlorosis", "Powdery Mildew");
        assertThat(session.state().getLastAsked()).isEqualTo("stunted growth");
        verify(generator, never()).generate(anyList(), anyString());
    }

    @Test
    void confirmingTheQuestionSeparatesTheLeader() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());
        session.processTurn("yellowing leaves");

        String response = session.processTurn("yes");

        assertThat(response).isEqualTo("DIAGNOSIS COMPLETE!\n\nnarrative");
        assertThat(session.state().getDiagnosedDisease()).isEqualTo("Iron Chlorosis");
        assertThat(session.state().getConfirmed()).containsExactly("yellowing leaves", "stunted growth");

        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(generator).generate(anyList(), context.capture());
        assertThat(context.getValue())
                .contains("DIAGNOSED disease: Iron Chlorosis (100.0% match)")
                .contains("DIAGNOSIS after 2 symptoms confirmed")
                .contains("TREATMENT - Iron Supplement: Apply iron chelate to soil according to package directions");
    }

    @Test
    void denyingTheQuestionMovesOnToTheNextSymptom() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());
        session.processTurn("yellowing leaves");

        String response = session.processTurn("no");

        assertThat(response).isEqualTo("Do you observe white powdery coating on the plant?");
        assertThat(session.state().getRuledOut()).containsExactly("stunted growth");
        assertThat(session.state().getConfirmed()).containsExactly("yellowing leaves");

        assertThat(session.processTurn("yes, definitely")).startsWith("DIAGNOSIS COMPLETE!");
        assertThat(session.state().getDiagnosedDisease()).isEqualTo("Powdery Mildew");
    }

    @Test
    void fourConfirmedSymptomsForceADiagnosis() {
        DiagnosticSession session = engine.openSession(TestGraphs.twins());

        assertThat(session.processTurn("alpha")).isEqualTo("Do you observe echo on the plant?");
        assertThat(session.processTurn("bravo")).isEqualTo("Do you observe golf on the plant?");
        assertThat(session.processTurn("charlie")).isEqualTo("Do you observe hotel on the plant?");

        String response = session.processTurn("delta");

        assertThat(response).isEqualTo("DIAGNOSIS (Analysis Complete)!\n\nnarrative");
        assertThat(session.state().getDiagnosedDisease()).isEqualTo("Disease A");
        assertThat(session.state().getConfirmed()).hasSize(4);
    }

    @Test
    void unknownSymptomAsksForMoreInformation() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String response = session.processTurn("purple stripes");

        assertThat(response).isEqualTo(ConversationEngine.NEED_MORE_INFO);
        assertThat(session.state().getPhase()).isEqualTo(Phase.COLLECTING);
        assertThat(session.state().getCandidateDiseases()).isEmpty();
    }

    @Test
    void emptyGraphNeverDiagnoses() {
        DiagnosticSession session = engine.openSession(GraphStore.empty());

        assertThat(session.processTurn("brown spots")).isEqualTo(ConversationEngine.NEED_MORE_INFO);
        assertThat(session.summary()).isEqualTo(ConversationEngine.NO_MATCHING_DISEASES);
    }

    @Test
    void blankInputDoesNotConsumeATurn() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        assertThat(session.processTurn("   ")).isEqualTo(ConversationEngine.ASK_FOR_SYMPTOMS);
        assertThat(session.processTurn(null)).isEqualTo(ConversationEngine.ASK_FOR_SYMPTOMS);
        assertThat(session.state().getTurn()).isZero();
        assertThat(session.state().getHistory()).isEmpty();
    }

    @Test
    void diagnosedSessionRepeatsItsDiagnosis() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());
        String diagnosis = session.processTurn("brown spots");

        assertThat(session.processTurn("yellowing leaves")).isEqualTo(diagnosis);
        assertThat(session.state().getTurn()).isEqualTo(1);
        assertThat(session.state().getConfirmed()).containsExactly("brown spots");
        verify(generator, times(1)).generate(anyList(), anyString());
    }

    @Test
    void failingGeneratorStillDiagnoses() {
        when(generator.generate(anyList(), anyString())).thenThrow(new IllegalStateException("boom"));
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        String response = session.processTurn("brown spots");

        assertThat(response).isEqualTo("FINAL DIAGNOSIS!\n\nDiagnosis text unavailable: boom");
        assertThat(session.state().getPhase()).isEqualTo(Phase.DIAGNOSED);
    }

    @Test
    void blankGeneratorOutputIsReported() {
        when(generator.generate(anyList(), anyString())).thenReturn("  ");
        DiagnosticSession session = engine.openSession(TestGraphs.sample());

        assertThat(session.processTurn("brown spots")).endsWith("Diagnosis text unavailable: empty response");
    }

    @Test
    void summaryLeavesStateUntouched() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());
        assertThat(session.summary()).isEqualTo(ConversationEngine.NO_SYMPTOMS_YET);

        session.processTurn("yellowing leaves");
        StateSnapshot before = session.currentState();

        assertThat(session.summary()).isEqualTo("narrative");
        assertThat(session.currentState()).isEqualTo(before);
        assertThat(session.state().getHistory()).hasSize(2);

        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(generator).generate(anyList(), context.capture());
        assertThat(context.getValue()).contains("SUMMARY ANALYSIS");
    }

    @Test
    void resetStartsOver() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());
        session.processTurn("brown spots");

        session.reset();

        StateSnapshot snapshot = session.currentState();
        assertThat(snapshot.phase()).isEqualTo(Phase.COLLECTING);
        assertThat(snapshot.turn()).isZero();
        assertThat(snapshot.confirmed()).isEmpty();
        assertThat(snapshot.candidateDiseases()).isEmpty();
        assertThat(session.state().getDiagnosis()).isNull();

        assertThat(session.processTurn("yellowing leaves")).isEqualTo("Do you observe stunted growth on the plant?");
    }

    @Test
    void historyRecordsBothSides() {
        DiagnosticSession session = engine.openSession(TestGraphs.sample());
        session.processTurn("yellowing leaves");
        session.processTurn("no");

        List<ConversationState.Exchange> history = session.state().getHistory();

        assertThat(history).extracting(ConversationState.Exchange::role)
                .containsExactly("user", "assistant", "user", "assistant");
        assertThat(history).extracting(ConversationState.Exchange::turn).containsExactly(1, 1, 2, 2);
    }

    @Test
    void sessionsDoNotShareState() {
        GraphStore store = TestGraphs.sample();
        DiagnosticSession first = engine.openSession(store);
        DiagnosticSession second = engine.openSession(store);

        first.processTurn("brown spots");

        assertThat(second.currentState().turn()).isZero();
        assertThat(second.processTurn("yellowing leaves")).isEqualTo("Do you observe stunted growth on the plant?");
    }
}
