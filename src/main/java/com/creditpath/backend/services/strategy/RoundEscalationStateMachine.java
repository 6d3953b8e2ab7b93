package com.creditpath.backend.services.strategy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.creditpath.backend.dto.strategy.RoundDecisionDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.enums.DisputeStatus;
import com.creditpath.backend.enums.PreviousResult;
import com.creditpath.backend.enums.StrategyRound;

/**
 * Escalation policy for one (item, bureau) pair.
 *
 * <p>The round is derived from how many disputes were already filed:
 * <pre>
 *   0 prior  -> round 1, previous result NONE
 *   1 prior  -> round 2, RESOLVED if that dispute was resolved, else VERIFIED
 *   2 prior  -> round 3, VERIFIED
 *   3+ prior -> round 4, VERIFIED (terminal)
 * </pre>
 * and the argument for the round comes from {@link #actionFor(StrategyRound, PreviousResult)}.
 */
@Component
public class RoundEscalationStateMachine {

    private static final Map<StrategyRound, Map<PreviousResult, EscalationAction>> TRANSITIONS;

    static {
        Map<StrategyRound, Map<PreviousResult, EscalationAction>> t = new EnumMap<>(StrategyRound.class);
        t.put(StrategyRound.INITIAL_DISPUTE, row(EscalationAction.PRIMARY, EscalationAction.PRIMARY, EscalationAction.PRIMARY));
        t.put(StrategyRound.VERIFICATION_CHALLENGE, row(EscalationAction.PRIMARY, EscalationAction.PRIMARY, EscalationAction.FIRST_ALTERNATIVE));
        t.put(StrategyRound.ESCALATION_WARNING, row(EscalationAction.ACCURACY_CHALLENGE, EscalationAction.ACCURACY_CHALLENGE, EscalationAction.ACCURACY_CHALLENGE));
        t.put(StrategyRound.REGULATORY_COMPLAINT, row(EscalationAction.ACCURACY_CHALLENGE, EscalationAction.ACCURACY_CHALLENGE, EscalationAction.ACCURACY_CHALLENGE));

        for (StrategyRound round : StrategyRound.values()) {
            Map<PreviousResult, EscalationAction> r = t.get(round);
            if (r == null || r.size() != PreviousResult.values().length) {
                throw new IllegalStateException("Incomplete escalation table for round " + round.getNumber());
            }
        }
        TRANSITIONS = Collections.unmodifiableMap(t);
    }

    private static Map<PreviousResult, EscalationAction> row(EscalationAction none, EscalationAction resolved, EscalationAction verified) {
        Map<PreviousResult, EscalationAction> r = new EnumMap<>(PreviousResult.class);
        r.put(PreviousResult.NONE, none);
        r.put(PreviousResult.RESOLVED, resolved);
        r.put(PreviousResult.VERIFIED, verified);
        return Collections.unmodifiableMap(r);
    }

    public RoundDecisionDTO determineRound(int priorAttemptCount, DisputeStatus lastAttemptStatus) {
        int count = Math.max(0, priorAttemptCount);

        StrategyRound round;
        PreviousResult previousResult;
        if (count == 0) {
            round = StrategyRound.INITIAL_DISPUTE;
            previousResult = PreviousResult.NONE;
        } else if (count == 1) {
            round = StrategyRound.VERIFICATION_CHALLENGE;
            previousResult = lastAttemptStatus == DisputeStatus.RESOLVED ? PreviousResult.RESOLVED : PreviousResult.VERIFIED;
        } else if (count == 2) {
            round = StrategyRound.ESCALATION_WARNING;
            previousResult = PreviousResult.VERIFIED;
        } else {
            round = StrategyRound.REGULATORY_COMPLAINT;
            previousResult = PreviousResult.VERIFIED;
        }

        return RoundDecisionDTO.builder()
                .round(round)
                .previousResult(previousResult)
                .priorAttempts(count)
                .build();
    }

    /**
     * Only the most recent attempt's status is considered; earlier outcomes do
     * not change the decision.
     */
    public RoundDecisionDTO determineRound(List<DisputeAttempt> priorAttempts) {
        if (priorAttempts == null || priorAttempts.isEmpty()) {
            return determineRound(0, null);
        }
        List<DisputeAttempt> attempts = priorAttempts.stream().filter(Objects::nonNull).toList();
        DisputeStatus lastStatus = attempts.stream()
                .max(Comparator.comparing(RoundEscalationStateMachine::attemptTimestamp,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(DisputeAttempt::getStatus)
                .orElse(null);
        return determineRound(attempts.size(), lastStatus);
    }

    public EscalationAction actionFor(StrategyRound round, PreviousResult previousResult) {
        StrategyRound r = round != null ? round : StrategyRound.INITIAL_DISPUTE;
        PreviousResult p = previousResult != null ? previousResult : PreviousResult.NONE;
        return TRANSITIONS.get(r).get(p);
    }

    private static LocalDateTime attemptTimestamp(DisputeAttempt attempt) {
        if (attempt.getCreatedAt() != null) {
            return attempt.getCreatedAt();
        }
        LocalDate sent = attempt.getSentDate();
        return sent != null ? sent.atStartOfDay() : null;
    }
}
