package com.lodestar.succession.lifecycle;

import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.eligibility.EligibilityEngine;
import com.lodestar.succession.evaluation.EvaluationService;
import com.lodestar.succession.evaluation.OutstandingScore;
import com.lodestar.succession.interview.InterviewService;
import com.lodestar.succession.domain.model.InterviewSlot;
import com.lodestar.succession.voting.VotingService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Named guards referenced from the {@link TransitionTable}.
 */
@Component
public class CycleGuards {

    public static final String ACTIVE_POSITION_PRESENT = "active-position-present";
    public static final String POSITION_CRITERIA_VALID = "position-criteria-valid";
    public static final String ELIGIBLE_CANDIDATE_PER_POSITION = "eligible-candidate-per-position";
    public static final String RUBRIC_DEFINED = "rubric-defined";
    public static final String EVALUATOR_PER_POSITION = "evaluator-per-position";
    public static final String SCORES_COMPLETE = "scores-complete";
    public static final String NO_FUTURE_INTERVIEWS = "no-future-interviews";
    public static final String COMMITTEE_SEATED = "committee-seated";
    public static final String SELECTION_PER_POSITION = "selection-per-position";
    public static final String ADMIN_APPROVAL = "admin-approval";

    private final EligibilityEngine eligibilityEngine;
    private final EvaluationService evaluationService;
    private final InterviewService interviewService;
    private final VotingService votingService;

    public CycleGuards(EligibilityEngine eligibilityEngine,
                       EvaluationService evaluationService,
                       InterviewService interviewService,
                       VotingService votingService) {
        this.eligibilityEngine = eligibilityEngine;
        this.evaluationService = evaluationService;
        this.interviewService = interviewService;
        this.votingService = votingService;
    }

    public TransitionGuard activePositionPresent() {
        return TransitionGuard.of(ACTIVE_POSITION_PRESENT, false, context ->
                context.getActivePositions().isEmpty()
                        ? GuardResult.fail("cycle has no active position")
                        : GuardResult.pass());
    }

    public TransitionGuard positionCriteriaValid() {
        return TransitionGuard.of(POSITION_CRITERIA_VALID, false, context -> {
            for (Position position : context.getActivePositions()) {
                Map<String, String> errors = eligibilityEngine.validate(position.getEligibilityCriteria(), context.getPolicy());
                if (!errors.isEmpty()) {
                    return GuardResult.fail("position '" + position.getTitle() + "' has invalid criteria: " + errors);
                }
            }
            return GuardResult.pass();
        });
    }

    public TransitionGuard eligibleCandidatePerPosition() {
        return TransitionGuard.of(ELIGIBLE_CANDIDATE_PER_POSITION, false, context -> {
            List<String> empty = context.getActivePositions().stream()
                    .filter(position -> context.roster().getOrDefault(position.getId(), List.of()).isEmpty())
                    .map(Position::getTitle)
                    .collect(Collectors.toList());
            return empty.isEmpty()
                    ? GuardResult.pass()
                    : GuardResult.fail("no eligible candidate for " + empty);
        });
    }

    public TransitionGuard rubricDefined() {
        return TransitionGuard.of(RUBRIC_DEFINED, false, context -> {
            List<String> missing = context.getActivePositions().stream()
                    .filter(position -> !evaluationService.hasValidRubric(position.getId(), context.getPolicy()))
                    .map(Position::getTitle)
                    .collect(Collectors.toList());
            return missing.isEmpty()
                    ? GuardResult.pass()
                    : GuardResult.fail("no valid rubric for " + missing);
        });
    }

    public TransitionGuard evaluatorPerPosition() {
        return TransitionGuard.of(EVALUATOR_PER_POSITION, false, context -> {
            Map<String, Long> counts = evaluationService.activeEvaluatorCounts(context.getWorking().getId());
            List<String> missing = context.getActivePositions().stream()
                    .filter(position -> counts.getOrDefault(position.getId(), 0L) == 0L)
                    .map(Position::getTitle)
                    .collect(Collectors.toList());
            return missing.isEmpty()
                    ? GuardResult.pass()
                    : GuardResult.fail("no non-recused evaluator for " + missing);
        });
    }

    public TransitionGuard scoresComplete() {
        return TransitionGuard.of(SCORES_COMPLETE, true, context -> {
            List<OutstandingScore> outstanding = evaluationService.outstandingScores(context.getWorking());
            return outstanding.isEmpty()
                    ? GuardResult.pass()
                    : GuardResult.fail(outstanding.size() + " evaluator/candidate pair(s) with missing scores");
        });
    }

    public TransitionGuard noFutureInterviews() {
        return TransitionGuard.of(NO_FUTURE_INTERVIEWS, true, context -> {
            List<InterviewSlot> future = interviewService.futureInterviews(context.getWorking().getId(), context.getNow());
            return future.isEmpty()
                    ? GuardResult.pass()
                    : GuardResult.fail(future.size() + " interview(s) still scheduled in the future");
        });
    }

    public TransitionGuard committeeSeated() {
        return TransitionGuard.of(COMMITTEE_SEATED, false, context ->
                context.getWorking().getSelectionCommitteeIds().isEmpty()
                        ? GuardResult.fail("selection committee is empty")
                        : GuardResult.pass());
    }

    public TransitionGuard selectionPerPosition() {
        return TransitionGuard.of(SELECTION_PER_POSITION, false, context -> {
            List<String> missing = context.getActivePositions().stream()
                    .filter(position -> votingService.activeSelection(position.getId()).isEmpty())
                    .map(Position::getTitle)
                    .collect(Collectors.toList());
            return missing.isEmpty()
                    ? GuardResult.pass()
                    : GuardResult.fail("no selection recorded for " + missing);
        });
    }

    public TransitionGuard adminApproval() {
        return TransitionGuard.of(ADMIN_APPROVAL, false, context ->
                context.getActor().isAdmin() && !context.getActor().isSystem()
                        ? GuardResult.pass()
                        : GuardResult.fail("completion requires an explicit admin approval"));
    }
}
