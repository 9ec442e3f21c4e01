package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.api.TextGenerator;
import de.conciso.plantdiag.model.CandidateDisease;
import de.conciso.plantdiag.service.DifferentiatorSelector;
import de.conciso.plantdiag.service.DiseaseRanker;
import de.conciso.plantdiag.service.GraphStore;
import de.conciso.plantdiag.service.SymptomMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Drives a diagnostic conversation: collects evidence turn by turn, asks the most
 * discriminating question next and commits to a diagnosis once the stop rules fire.
 *
 * <p>The engine itself is stateless. Each call receives the session's
 * {@link ConversationState} and the shared, read-only {@link GraphStore}, so one
 * engine serves any number of concurrent sessions.</p>
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    static final String ASK_FOR_SYMPTOMS = "Describe what you observe on the plant (for example: yellowing leaves).";
    static final String NEED_MORE_INFO = "I need more information. Please describe any other symptoms you observe.";
    static final String NO_SYMPTOMS_YET = "No symptoms confirmed yet. Please describe what you observe on the plant.";
    static final String NO_MATCHING_DISEASES = "No matching diseases found in graph for the confirmed symptoms.";
    static final String TEXT_UNAVAILABLE = "Diagnosis text unavailable: ";

    private final SymptomMatcher matcher;
    private final DiseaseRanker ranker;
    private final DifferentiatorSelector selector;
    private final DiagnosisPolicy policy;
    private final ReplyClassifier classifier;
    private final QuestionFormatter formatter;
    private final DiagnosisContextBuilder contextBuilder;
    private final TextGenerator textGenerator;
    private final int maxCandidates;

    public ConversationEngine(
            SymptomMatcher matcher,
            DiseaseRanker ranker,
            DifferentiatorSelector selector,
            DiagnosisPolicy policy,
            ReplyClassifier classifier,
            QuestionFormatter formatter,
            DiagnosisContextBuilder contextBuilder,
            TextGenerator textGenerator,
            @Value("${diagnostic.ranking.max-candidates:8}") int maxCandidates
    ) {
        this.matcher = matcher;
        this.ranker = ranker;
        this.selector = selector;
        this.policy = policy;
        this.classifier = classifier;
        this.formatter = formatter;
        this.contextBuilder = contextBuilder;
        this.textGenerator = textGenerator;
        this.maxCandidates = maxCandidates;
    }

    public DiagnosticSession openSession(GraphStore store) {
        return new DiagnosticSession(this, store, new ConversationState());
    }

    /** Handles one user turn and returns the text to show. Never throws for bad input or a failing generator. */
    public String process(GraphStore store, ConversationState state, String userInput) {
        if (state.getPhase() == Phase.DIAGNOSED) {
            return state.getDiagnosis();
        }
        String input = userInput == null ? "" : userInput.trim();
        if (input.isEmpty()) {
            return ASK_FOR_SYMPTOMS;
        }

        boolean firstTurn = state.nextTurn() == 1;
        state.record("user", input);

        if (firstTurn) {
            addSymptom(state, input);
        } else {
            applyReply(state, input);
        }
        rerank(store, state);

        Optional<Verdict> verdict = policy.evaluate(state.getConfirmed().size(), state.getCandidateDiseases());
        if (verdict.isPresent()) {
            return diagnose(store, state, verdict.get().disease(), Framing.of(verdict.get().reason(), firstTurn));
        }
        return nextQuestion(store, state);
    }

    /** One-shot narrative for the current evidence. Leaves the state untouched. */
    public String summary(GraphStore store, ConversationState state) {
        if (state.getConfirmed().isEmpty()) {
            return NO_SYMPTOMS_YET;
        }
        List<CandidateDisease> diseases = rankCapped(store, state);
        if (diseases.isEmpty()) {
            return NO_MATCHING_DISEASES;
        }
        String context = contextBuilder.build(store, state, diseases.get(0),
                Framing.SUMMARY.note(state.getConfirmed().size()));
        return generate(state, context);
    }

    public StateSnapshot currentState(ConversationState state) {
        return StateSnapshot.of(state);
    }

    public void reset(ConversationState state) {
        state.clear();
        log.info("Conversation reset");
    }

    // -------------------------------------------------------------------------

    private void applyReply(ConversationState state, String input) {
        ReplyType type = classifier.classify(input);
        String pending = state.getLastAsked();
        log.debug("Reply '{}' classified as {}", input, type);
        switch (type) {
            case CONFIRMED -> {
                if (pending != null) {
                    state.confirm(matcher.normalize(pending));
                    log.info("Confirmed: '{}'", pending);
                } else {
                    log.warn("Confirmation without a pending question, ignored");
                }
            }
            case DENIED -> {
                if (pending != null) {
                    state.ruleOut(matcher.normalize(pending));
                    log.info("Ruled out: '{}'", pending);
                } else {
                    log.warn("Denial without a pending question, ignored");
                }
            }
            case NEW_SYMPTOM -> addSymptom(state, input);
        }
    }

    private void addSymptom(ConversationState state, String input) {
        String symptom = matcher.normalize(input);
        if (!symptom.isEmpty() && state.confirm(symptom)) {
            log.info("New symptom: '{}'", symptom);
        }
    }

    private void rerank(GraphStore store, ConversationState state) {
        state.candidateDiseases(rankCapped(store, state));
        log.info("{} candidate disease(s): {}", state.getCandidateDiseases().size(),
                state.getCandidateDiseases().stream()
                        .limit(3)
                        .map(d -> d.name() + " (" + DiagnosisContextBuilder.percent(d.matchPercentage()) + ")")
                        .toList());
    }

    private List<CandidateDisease> rankCapped(GraphStore store, ConversationState state) {
        List<CandidateDisease> ranked = ranker.rank(store, state.getConfirmed());
        return ranked.size() > maxCandidates ? ranked.subList(0, maxCandidates) : ranked;
    }

    private String nextQuestion(GraphStore store, ConversationState state) {
        List<CandidateDisease> candidates = state.getCandidateDiseases();
        List<String> topNames = candidates.stream()
                .limit(DifferentiatorSelector.MAX_DISEASES)
                .map(CandidateDisease::name)
                .toList();

        Optional<String> next = selector.select(store, topNames, state.exclusions());
        if (next.isPresent()) {
            state.markAsked(next.get());
            String question = formatter.format(next.get());
            state.record("assistant", question);
            log.info("Asking: '{}'", question);
            return question;
        }

        if (candidates.isEmpty()) {
            state.record("assistant", NEED_MORE_INFO);
            return NEED_MORE_INFO;
        }
        log.info("No more differentiating symptoms, diagnosing {}", candidates.get(0).name());
        return diagnose(store, state, candidates.get(0), Framing.of(StopReason.NO_MORE_QUESTIONS, state.getTurn() == 1));
    }

    private String diagnose(GraphStore store, ConversationState state, CandidateDisease disease, Framing framing) {
        String context = contextBuilder.build(store, state, disease, framing.note(state.getConfirmed().size()));
        String response = framing.present(generate(state, context));
        state.diagnosed(disease.name(), response);
        state.record("assistant", response);
        log.info("Diagnosed {} after {} turn(s)", disease.name(), state.getTurn());
        return response;
    }

    private String generate(ConversationState state, String context) {
        try {
            String text = textGenerator.generate(List.copyOf(state.getConfirmed()), context);
            return text == null || text.isBlank() ? TEXT_UNAVAILABLE + "empty response" : text;
        } catch (RuntimeException e) {
            log.warn("Text generation failed: {}", e.getMessage());
            return TEXT_UNAVAILABLE + e.getMessage();
        }
    }
}
