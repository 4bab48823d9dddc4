package com.lodestar.succession.lifecycle;

import com.lodestar.succession.domain.model.CycleStatus;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.lodestar.succession.domain.model.CycleStatus.*;

/**
 * Forward edges of the cycle lifecycle with the guards and side effects attached to each.
 * <p>
 * The applications branch ({@code applications_open}, {@code applications_closed}) sits between
 * {@code nominations_closed} and {@code evaluations} and is only taken when the cycle enables it.
 */
@Component
public class TransitionTable {

    private static final Set<CycleStatus> MANUAL = EnumSet.of(DRAFT, APPROVAL_PENDING, ARCHIVED);

    private final Map<CycleStatus, Rule> rulesByTarget = new EnumMap<>(CycleStatus.class);

    public TransitionTable(CycleGuards guards, CycleEffects effects) {
        rulesByTarget.put(ACTIVE, new Rule(
                List.of(guards.activePositionPresent(), guards.positionCriteriaValid()),
                List.of()));
        rulesByTarget.put(NOMINATIONS_OPEN, new Rule(
                List.of(),
                List.of(effects.eligibilityRecompute())));
        rulesByTarget.put(EVALUATIONS, new Rule(
                List.of(guards.eligibleCandidatePerPosition(), guards.rubricDefined(), guards.evaluatorPerPosition()),
                List.of(effects.rosterFreeze())));
        rulesByTarget.put(EVALUATIONS_CLOSED, new Rule(
                List.of(guards.scoresComplete()),
                List.of()));
        rulesByTarget.put(INTERVIEWS_CLOSED, new Rule(
                List.of(guards.noFutureInterviews()),
                List.of()));
        rulesByTarget.put(SELECTION, new Rule(
                List.of(guards.committeeSeated()),
                List.of(effects.votingOpened())));
        rulesByTarget.put(APPROVAL_PENDING, new Rule(
                List.of(guards.selectionPerPosition()),
                List.of()));
        rulesByTarget.put(COMPLETED, new Rule(
                List.of(guards.adminApproval()),
                List.of(effects.publishResults())));
    }

    /**
     * Next status on the forward path, or empty for {@code archived}.
     */
    public static Optional<CycleStatus> forwardTarget(CycleStatus from, boolean applicationsPhaseEnabled) {
        return Optional.ofNullable(switch (from) {
            case DRAFT -> ACTIVE;
            case ACTIVE -> NOMINATIONS_OPEN;
            case NOMINATIONS_OPEN -> NOMINATIONS_CLOSED;
            case NOMINATIONS_CLOSED -> applicationsPhaseEnabled ? APPLICATIONS_OPEN : EVALUATIONS;
            case APPLICATIONS_OPEN -> APPLICATIONS_CLOSED;
            case APPLICATIONS_CLOSED -> EVALUATIONS;
            case EVALUATIONS -> EVALUATIONS_CLOSED;
            case EVALUATIONS_CLOSED -> INTERVIEWS;
            case INTERVIEWS -> INTERVIEWS_CLOSED;
            case INTERVIEWS_CLOSED -> SELECTION;
            case SELECTION -> APPROVAL_PENDING;
            case APPROVAL_PENDING -> COMPLETED;
            case COMPLETED -> ARCHIVED;
            case ARCHIVED -> null;
        });
    }

    public static boolean isForwardEdge(CycleStatus from, CycleStatus to, boolean applicationsPhaseEnabled) {
        return forwardTarget(from, applicationsPhaseEnabled).filter(to::equals).isPresent();
    }

    /**
     * Whether the scheduler may leave this stage on its own once the deadline passes.
     */
    public static boolean isAutomated(CycleStatus from) {
        return !MANUAL.contains(from);
    }

    public List<TransitionGuard> guardsFor(CycleStatus to) {
        return rule(to).guards();
    }

    public List<TransitionEffect> effectsFor(CycleStatus to) {
        return rule(to).effects();
    }

    private Rule rule(CycleStatus to) {
        return rulesByTarget.getOrDefault(to, Rule.NONE);
    }

    private record Rule(List<TransitionGuard> guards, List<TransitionEffect> effects) {
        static final Rule NONE = new Rule(List.of(), List.of());
    }
}
