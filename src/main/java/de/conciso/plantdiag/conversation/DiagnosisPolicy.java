package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.model.CandidateDisease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether the evidence collected so far is enough to commit to a diagnosis.
 * Rules are evaluated in priority order; the forced stop on
 * {@value #FORCE_AFTER_SYMPTOMS} confirmed symptoms applies regardless of confidence.
 */
@Component
public class DiagnosisPolicy {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisPolicy.class);

    static final int MIN_CONFIRMED = 2;
    static final double DECISIVE_GAP = 0.20;
    static final double STRONG_MATCH = 0.70;
    static final double STRONG_MATCH_GAP = 0.10;
    static final int CONFIDENT_MATCH_COUNT = 3;
    static final double CONFIDENT_MATCH = 0.60;
    static final int FORCE_AFTER_SYMPTOMS = 4;

    public Optional<Verdict> evaluate(int confirmedCount, List<CandidateDisease> candidates) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();
        CandidateDisease top = candidates.get(0);

        Optional<Verdict> confident = confidentStop(confirmedCount, candidates);
        if (confident.isPresent()) return confident;

        if (confirmedCount >= FORCE_AFTER_SYMPTOMS) {
            log.info("{} symptoms confirmed, forcing diagnosis on {}", confirmedCount, top.name());
            return Optional.of(new Verdict(top, StopReason.SUFFICIENT_EVIDENCE));
        }
        log.debug("Not enough confidence yet, top {} at {}", top.name(), top.matchPercentage());
        return Optional.empty();
    }

    private Optional<Verdict> confidentStop(int confirmedCount, List<CandidateDisease> candidates) {
        if (confirmedCount < MIN_CONFIRMED) return Optional.empty();
        CandidateDisease top = candidates.get(0);

        if (candidates.size() == 1) {
            log.info("Only {} matches, definitive diagnosis", top.name());
            return Optional.of(new Verdict(top, StopReason.SINGLE_CANDIDATE));
        }

        double gap = top.matchPercentage() - candidates.get(1).matchPercentage();
        log.debug("Top {} ({}), gap to second {}", top.name(), top.matchPercentage(), gap);
        if (gap > DECISIVE_GAP || (top.matchPercentage() > STRONG_MATCH && gap > STRONG_MATCH_GAP)) {
            return Optional.of(new Verdict(top, StopReason.CLEAR_LEADER));
        }
        if (top.matchCount() >= CONFIDENT_MATCH_COUNT && top.matchPercentage() >= CONFIDENT_MATCH) {
            return Optional.of(new Verdict(top, StopReason.HIGH_CONFIDENCE));
        }
        return Optional.empty();
    }
}
