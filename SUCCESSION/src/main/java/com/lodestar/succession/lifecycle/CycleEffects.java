package com.lodestar.succession.lifecycle;

import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.error.EligibilityComputationException;
import com.lodestar.succession.domain.model.EvaluatorAssignment;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.Selection;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.eligibility.EligibilityService;
import com.lodestar.succession.eligibility.RecomputeReport;
import com.lodestar.succession.evaluation.EvaluationService;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.voting.VotingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Side effects referenced from the {@link TransitionTable}. Each prepare step reads and
 * computes; the returned apply step only writes the working cycle and queues notifications.
 */
@Slf4j
@Component
public class CycleEffects {

    public static final String ELIGIBILITY_RECOMPUTE = "eligibility-recompute";
    public static final String ROSTER_FREEZE = "roster-freeze";
    public static final String VOTING_OPENED = "voting-opened";
    public static final String PUBLISH_RESULTS = "publish-results";

    private final EligibilityService eligibilityService;
    private final EvaluationService evaluationService;
    private final VotingService votingService;
    private final SuccessionProperties properties;

    public CycleEffects(EligibilityService eligibilityService,
                        EvaluationService evaluationService,
                        VotingService votingService,
                        SuccessionProperties properties) {
        this.eligibilityService = eligibilityService;
        this.evaluationService = evaluationService;
        this.votingService = votingService;
        this.properties = properties;
    }

    /**
     * Recompute eligibility for the whole chapter, then tell every eligible member that
     * nominations are open. Derived eligibility records are written during prepare.
     */
    public TransitionEffect eligibilityRecompute() {
        return TransitionEffect.of(ELIGIBILITY_RECOMPUTE, context -> {
            RecomputeReport report = eligibilityService.recompute(context.getWorking(), context.getActor())
                    .block(properties.getEligibility().getRecomputeTimeout());
            if (report == null) {
                throw new EligibilityComputationException("recompute produced no report", null);
            }
            Set<String> eligible = eligibilityService.eligibleMembers(context.getActivePositions());
            SuccessionCycle cycle = context.getWorking();
            return () -> {
                context.notify(eligible, NotificationTemplate.YOU_ARE_ELIGIBLE, cycleContext(cycle));
                context.notify(properties.getNotifications().getAdminRecipients(),
                        NotificationTemplate.NOMINATIONS_OPENED, cycleContext(cycle));
            };
        });
    }

    /**
     * Freeze the eligible active candidates of every position; scores, interviews and ballots
     * are only accepted for the frozen roster from here on.
     */
    public TransitionEffect rosterFreeze() {
        return TransitionEffect.of(ROSTER_FREEZE, context -> {
            Map<String, List<String>> roster = new LinkedHashMap<>();
            context.roster().forEach((positionId, candidates) -> roster.put(positionId, new ArrayList<>(candidates)));
            Set<String> evaluators = new LinkedHashSet<>();
            for (Position position : context.getActivePositions()) {
                List<String> candidates = roster.getOrDefault(position.getId(), List.of());
                evaluationService.listAssignments(position.getId()).stream()
                        .filter(assignment -> !assignment.isRecused())
                        .filter(assignment -> candidates.contains(assignment.getCandidateId()))
                        .map(EvaluatorAssignment::getEvaluatorId)
                        .forEach(evaluators::add);
            }
            SuccessionCycle cycle = context.getWorking();
            return () -> {
                cycle.setRosterSnapshot(roster);
                context.notify(evaluators, NotificationTemplate.ASSIGNED_EVALUATOR, cycleContext(cycle));
                roster.forEach((positionId, candidates) -> {
                    Map<String, Object> positionContext = new LinkedHashMap<>(cycleContext(cycle));
                    positionContext.put("positionId", positionId);
                    context.notify(candidates, NotificationTemplate.CANDIDACY_ADVANCED, positionContext);
                });
                log.info("Roster frozen for cycle {}: {}", cycle.getId(), roster);
            };
        });
    }

    public TransitionEffect votingOpened() {
        return TransitionEffect.of(VOTING_OPENED, context -> {
            SuccessionCycle cycle = context.getWorking();
            List<String> committee = List.copyOf(cycle.getSelectionCommitteeIds());
            return () -> context.notify(committee, NotificationTemplate.VOTING_OPENED, cycleContext(cycle));
        });
    }

    /**
     * Publish the outcome: selected candidates and every other rostered candidate are told.
     */
    public TransitionEffect publishResults() {
        return TransitionEffect.of(PUBLISH_RESULTS, context -> {
            SuccessionCycle cycle = context.getWorking();
            Map<String, String> selectedByPosition = new LinkedHashMap<>();
            Map<String, List<String>> notSelectedByPosition = new LinkedHashMap<>();
            for (Position position : context.getActivePositions()) {
                String selected = votingService.activeSelection(position.getId())
                        .map(Selection::getCandidateId)
                        .orElseThrow(() -> new IllegalStateException("no active selection for " + position.getId()));
                selectedByPosition.put(position.getId(), selected);
                List<String> others = new ArrayList<>(cycle.frozenRoster(position.getId()));
                others.remove(selected);
                notSelectedByPosition.put(position.getId(), others);
            }
            return () -> {
                cycle.setPublished(true);
                cycle.setPublishedAt(context.getNow());
                selectedByPosition.forEach((positionId, candidateId) -> {
                    Map<String, Object> positionContext = new LinkedHashMap<>(cycleContext(cycle));
                    positionContext.put("positionId", positionId);
                    context.notify(List.of(candidateId), NotificationTemplate.YOU_ARE_SELECTED, positionContext);
                    context.notify(notSelectedByPosition.get(positionId), NotificationTemplate.NOT_SELECTED, positionContext);
                });
            };
        });
    }

    private static Map<String, Object> cycleContext(SuccessionCycle cycle) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("cycleId", cycle.getId());
        values.put("cycleName", cycle.getName());
        return values;
    }
}
