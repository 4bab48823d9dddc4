package com.lodestar.succession.evaluation;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.*;
import com.lodestar.succession.domain.repository.EvaluationRepository;
import com.lodestar.succession.domain.repository.NominationRepository;
import com.lodestar.succession.domain.repository.PositionRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.policy.ChapterPolicy;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Rubrics, evaluator assignment, scoring and ranking.
 * <p>
 * Rubrics lock once the cycle reaches evaluations. Scores are accepted only during
 * evaluations, only from the assigned, non-recused evaluator named in the key, and only for
 * candidates on the frozen roster.
 */
@Slf4j
@Service
public class EvaluationService {

    static final String RECUSAL_SELF = "evaluator is the candidate";
    static final String RECUSAL_NOMINATOR = "evaluator nominated the candidate";
    static final String RECUSAL_DECLARED = "declared close relation";

    private final EvaluationRepository evaluationRepository;
    private final NominationRepository nominationRepository;
    private final PositionRepository positionRepository;
    private final ScoreAggregator scoreAggregator;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final ChapterPolicyResolver policyResolver;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final SuccessionMetrics metrics;
    private final Clock clock;

    public EvaluationService(EvaluationRepository evaluationRepository,
                             NominationRepository nominationRepository,
                             PositionRepository positionRepository,
                             ScoreAggregator scoreAggregator,
                             CycleLookup cycleLookup,
                             CycleLockRegistry locks,
                             ChapterPolicyResolver policyResolver,
                             AuditService auditService,
                             NotificationDispatcher notificationDispatcher,
                             SuccessionMetrics metrics,
                             Clock clock) {
        this.evaluationRepository = evaluationRepository;
        this.nominationRepository = nominationRepository;
        this.positionRepository = positionRepository;
        this.scoreAggregator = scoreAggregator;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.policyResolver = policyResolver;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Rubric ==========

    /**
     * Replace the rubric of a position. Weights must lie in [0,1] and sum to 1.
     */
    public List<EvaluationCriterion> defineRubric(Actor actor, String positionId, List<CriterionDefinition> definitions) {
        CycleLookup.requireAdmin(actor, "define a rubric");
        Position position = cycleLookup.requirePosition(positionId);
        return locks.withReadLock(position.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(position.getCycleId());
            cycleLookup.requireStage(cycle, status -> !status.isRosterFrozen(), "Rubric changes");
            ChapterPolicy policy = policyResolver.forCycle(cycle);
            validateRubric(definitions, policy, cycle.getStatus());

            List<EvaluationCriterion> criteria = new ArrayList<>();
            for (int i = 0; i < definitions.size(); i++) {
                CriterionDefinition definition = definitions.get(i);
                criteria.add(EvaluationCriterion.builder()
                        .id(UUID.randomUUID().toString())
                        .positionId(positionId)
                        .name(definition.getName().trim())
                        .description(definition.getDescription())
                        .weight(definition.getWeight())
                        .displayOrder(i + 1)
                        .build());
            }
            List<EvaluationCriterion> previous = evaluationRepository.findRubric(positionId);
            List<EvaluationCriterion> saved = evaluationRepository.saveRubric(positionId, criteria);
            auditService.record(cycle.getId(), actor, "rubric.define", "Position", positionId,
                    "Rubric with " + saved.size() + " criteria", Map.of("criteria", previous), Map.of("criteria", saved));
            return saved;
        });
    }

    public List<EvaluationCriterion> getRubric(String positionId) {
        return evaluationRepository.findRubric(positionId);
    }

    public boolean hasValidRubric(String positionId, ChapterPolicy policy) {
        List<EvaluationCriterion> rubric = evaluationRepository.findRubric(positionId);
        if (rubric.isEmpty()) {
            return false;
        }
        double total = rubric.stream().mapToDouble(EvaluationCriterion::getWeight).sum();
        return Math.abs(total - 1.0) <= policy.weightTolerance();
    }

    // ========== Assignment ==========

    /**
     * Record a close relation between two members; evaluators are recused from candidates they
     * are related to.
     */
    public void declareConflict(Actor actor, String cycleId, String evaluatorId, String memberId, String reason) {
        CycleLookup.requireAdmin(actor, "declare a conflict of interest");
        cycleLookup.requireCycle(cycleId);
        if (evaluatorId == null || memberId == null || evaluatorId.equals(memberId)) {
            throw new ValidationException("memberId", "two distinct members are required");
        }
        evaluationRepository.declareConflict(evaluatorId, memberId);
        auditService.record(cycleId, actor, "conflict.declare", "Member", evaluatorId,
                "Declared relation between " + evaluatorId + " and " + memberId
                        + (reason != null && !reason.isBlank() ? ": " + reason.trim() : ""),
                null, null);
    }

    /**
     * Assign evaluators to candidates of a position. Without explicit candidates, every active
     * candidate (or the frozen roster, once taken) is used. Conflicted pairs are recorded as
     * recused.
     */
    public List<EvaluatorAssignment> assignEvaluators(Actor actor, String cycleId, String positionId,
                                                      List<String> evaluatorIds, List<String> candidateIds) {
        CycleLookup.requireAdmin(actor, "assign evaluators");
        if (evaluatorIds == null || evaluatorIds.isEmpty()) {
            throw new ValidationException("evaluatorIds", "at least one evaluator is required");
        }
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle,
                    status -> status.ordinal() >= CycleStatus.NOMINATIONS_OPEN.ordinal()
                            && status.ordinal() <= CycleStatus.EVALUATIONS.ordinal(),
                    "Evaluator assignment");
            Position position = cycleLookup.requireActivePosition(cycle, positionId);

            Map<String, Nomination> candidacies = nominationRepository.findByPositionId(positionId).stream()
                    .collect(Collectors.toMap(Nomination::getNomineeId, nomination -> nomination));
            List<String> targets = candidateIds != null && !candidateIds.isEmpty()
                    ? candidateIds
                    : defaultCandidates(cycle, positionId);

            List<EvaluatorAssignment> created = new ArrayList<>();
            Instant now = clock.instant();
            for (String evaluatorId : new LinkedHashSet<>(evaluatorIds)) {
                for (String candidateId : new LinkedHashSet<>(targets)) {
                    Nomination candidacy = candidacies.get(candidateId);
                    if (candidacy == null || !candidacy.isActiveCandidate()) {
                        throw new ValidationException(Map.of("candidateIds",
                                candidateId + " is not an active candidate for " + position.getTitle()), cycle.getStatus());
                    }
                    if (cycle.getStatus().isRosterFrozen() && !cycle.frozenRoster(positionId).contains(candidateId)) {
                        throw new ValidationException(Map.of("candidateIds",
                                candidateId + " is not on the frozen roster"), cycle.getStatus());
                    }
                    // An earlier recusal survives reassignment.
                    String recusal = evaluationRepository.findAssignment(positionId, evaluatorId, candidateId)
                            .filter(EvaluatorAssignment::isRecused)
                            .map(EvaluatorAssignment::getRecusalReason)
                            .orElseGet(() -> recusalReason(evaluatorId, candidacy));
                    EvaluatorAssignment assignment = EvaluatorAssignment.builder()
                            .cycleId(cycleId)
                            .positionId(positionId)
                            .evaluatorId(evaluatorId)
                            .candidateId(candidateId)
                            .recused(recusal != null)
                            .recusalReason(recusal)
                            .assignedBy(actor.id())
                            .assignedAt(now)
                            .build();
                    evaluationRepository.saveAssignment(assignment);
                    created.add(assignment);
                    if (recusal != null) {
                        log.info("Evaluator {} recused from candidate {} of position {}: {}",
                                evaluatorId, candidateId, positionId, recusal);
                    }
                }
            }
            auditService.record(cycleId, actor, "evaluator.assign", "Position", positionId,
                    created.size() + " assignments, " + created.stream().filter(EvaluatorAssignment::isRecused).count() + " recused",
                    null, Map.of("assignments", created));

            if (cycle.getStatus() == CycleStatus.EVALUATIONS) {
                notifyEvaluators(cycle, created);
            }
            return created;
        });
    }

    /**
     * Evaluator steps back from a candidate, or an admin recuses them.
     */
    public EvaluatorAssignment recuse(Actor actor, String cycleId, String positionId, String evaluatorId,
                                      String candidateId, String reason) {
        if (!actor.isAdmin() && !actor.id().equals(evaluatorId)) {
            throw new AuthorizationException("Only the evaluator or an admin may record a recusal");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, status -> status.ordinal() <= CycleStatus.EVALUATIONS.ordinal(), "Recusal");
            EvaluatorAssignment assignment = evaluationRepository.findAssignment(positionId, evaluatorId, candidateId)
                    .orElseThrow(() -> new ConflictException("No assignment of " + evaluatorId + " to " + candidateId,
                            cycle.getStatus()));
            EvaluatorAssignment recused = EvaluatorAssignment.builder()
                    .cycleId(assignment.getCycleId())
                    .positionId(positionId)
                    .evaluatorId(evaluatorId)
                    .candidateId(candidateId)
                    .recused(true)
                    .recusalReason(reason.trim())
                    .assignedBy(assignment.getAssignedBy())
                    .assignedAt(assignment.getAssignedAt())
                    .build();
            evaluationRepository.saveAssignment(recused);
            auditService.record(cycleId, actor, "evaluator.recuse", "EvaluatorAssignment",
                    evaluatorId + "/" + candidateId, "Recused: " + reason.trim(), assignment, recused);
            return recused;
        });
    }

    public List<EvaluatorAssignment> listAssignments(String positionId) {
        return evaluationRepository.findAssignmentsByPosition(positionId);
    }

    /**
     * Non-recused evaluators per active position of the cycle.
     */
    public Map<String, Long> activeEvaluatorCounts(String cycleId) {
        Map<String, Long> counts = new HashMap<>();
        for (Position position : positionRepository.findByCycleId(cycleId)) {
            if (!position.isActive()) {
                continue;
            }
            counts.put(position.getId(), evaluationRepository.findAssignmentsByPosition(position.getId()).stream()
                    .filter(assignment -> !assignment.isRecused())
                    .map(EvaluatorAssignment::getEvaluatorId)
                    .distinct()
                    .count());
        }
        return counts;
    }

    public void notifyEvaluators(SuccessionCycle cycle, List<EvaluatorAssignment> assignments) {
        assignments.stream()
                .filter(assignment -> !assignment.isRecused())
                .map(EvaluatorAssignment::getEvaluatorId)
                .distinct()
                .forEach(evaluatorId -> notificationDispatcher.dispatch(NotificationRequest.of(evaluatorId,
                        NotificationTemplate.ASSIGNED_EVALUATOR,
                        Map.of("cycleId", cycle.getId(), "cycleName", cycle.getName()))));
    }

    // ========== Scoring ==========

    public EvaluationScore submitScore(Actor actor, String cycleId, ScoreSubmission submission) {
        if (submission.getEvaluatorId() != null && !submission.getEvaluatorId().equals(actor.id())) {
            throw new AuthorizationException("Scores may only be submitted under the acting evaluator's own identity");
        }
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, CycleStatus::acceptsScores, "Scoring");
            ChapterPolicy policy = policyResolver.forCycle(cycle);
            String positionId = submission.getPositionId();
            cycleLookup.requireActivePosition(cycle, positionId);

            EvaluatorAssignment assignment = evaluationRepository
                    .findAssignment(positionId, actor.id(), submission.getCandidateId())
                    .orElseThrow(() -> new AuthorizationException(
                            actor.id() + " is not assigned to evaluate " + submission.getCandidateId(), cycle.getStatus()));
            if (assignment.isRecused()) {
                throw new AuthorizationException(actor.id() + " is recused from " + submission.getCandidateId()
                        + ": " + assignment.getRecusalReason(), cycle.getStatus());
            }
            if (!cycle.frozenRoster(positionId).contains(submission.getCandidateId())) {
                throw new ConflictException(submission.getCandidateId() + " is not on the roster of " + positionId,
                        cycle.getStatus());
            }

            Map<String, String> errors = new LinkedHashMap<>();
            boolean knownCriterion = evaluationRepository.findRubric(positionId).stream()
                    .anyMatch(criterion -> criterion.getId().equals(submission.getCriterionId()));
            if (!knownCriterion) {
                errors.put("criterionId", "not part of the rubric");
            }
            if (!policy.isScoreInScale(submission.getRawScore())) {
                errors.put("rawScore", "must be between " + policy.scoreScaleMin() + " and " + policy.scoreScaleMax());
            }
            ValidationException.throwIfAny(errors, cycle.getStatus());

            EvaluationScore score = EvaluationScore.builder()
                    .evaluatorId(actor.id())
                    .candidateId(submission.getCandidateId())
                    .criterionId(submission.getCriterionId())
                    .positionId(positionId)
                    .rawScore(submission.getRawScore())
                    .comments(submission.getComments())
                    .submittedAt(clock.instant())
                    .build();
            EvaluationScore stored = evaluationRepository.upsertScore(score);
            metrics.recordScore();
            auditService.record(cycleId, actor, "score.submit", "EvaluationScore",
                    actor.id() + "/" + submission.getCandidateId() + "/" + submission.getCriterionId(),
                    "Score " + submission.getRawScore(), null, stored);
            return stored;
        });
    }

    /**
     * Non-recused (evaluator, candidate) pairs with missing criteria, across the cycle.
     */
    public List<OutstandingScore> outstandingScores(SuccessionCycle cycle) {
        List<OutstandingScore> outstanding = new ArrayList<>();
        for (Position position : positionRepository.findByCycleId(cycle.getId())) {
            if (!position.isActive()) {
                continue;
            }
            List<String> roster = cycle.frozenRoster(position.getId());
            List<EvaluationCriterion> rubric = evaluationRepository.findRubric(position.getId());
            Map<String, Set<String>> scored = new HashMap<>();
            for (EvaluationScore score : evaluationRepository.findScoresByPosition(position.getId())) {
                scored.computeIfAbsent(score.getEvaluatorId() + '|' + score.getCandidateId(), key -> new HashSet<>())
                        .add(score.getCriterionId());
            }
            for (EvaluatorAssignment assignment : evaluationRepository.findAssignmentsByPosition(position.getId())) {
                if (assignment.isRecused() || !roster.contains(assignment.getCandidateId())
                        || !isActiveCandidate(position.getId(), assignment.getCandidateId())) {
                    continue;
                }
                Set<String> done = scored.getOrDefault(assignment.getEvaluatorId() + '|' + assignment.getCandidateId(), Set.of());
                List<String> missing = rubric.stream()
                        .map(EvaluationCriterion::getId)
                        .filter(criterionId -> !done.contains(criterionId))
                        .collect(Collectors.toList());
                if (!missing.isEmpty()) {
                    outstanding.add(new OutstandingScore(position.getId(), assignment.getEvaluatorId(),
                            assignment.getCandidateId(), missing));
                }
            }
        }
        return outstanding;
    }

    public List<EvaluationScore> listScores(String positionId) {
        return evaluationRepository.findScoresByPosition(positionId);
    }

    public List<OutstandingScore> outstandingScores(String cycleId) {
        return outstandingScores(cycleLookup.requireCycle(cycleId));
    }

    /**
     * Ranked totals of the rostered, still active candidates of a position.
     */
    public List<CandidateScore> rankings(String cycleId, String positionId) {
        SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
        cycleLookup.requireActivePosition(cycle, positionId);
        List<String> roster = cycle.frozenRoster(positionId);
        List<Nomination> candidates = nominationRepository.findByPositionId(positionId).stream()
                .filter(Nomination::isActiveCandidate)
                .filter(nomination -> roster.contains(nomination.getNomineeId()))
                .collect(Collectors.toList());
        return scoreAggregator.rank(
                evaluationRepository.findRubric(positionId),
                candidates,
                evaluationRepository.findAssignmentsByPosition(positionId),
                evaluationRepository.findScoresByPosition(positionId),
                policyResolver.forCycle(cycle));
    }

    private List<String> defaultCandidates(SuccessionCycle cycle, String positionId) {
        if (cycle.getStatus().isRosterFrozen()) {
            return cycle.frozenRoster(positionId);
        }
        return nominationRepository.findByPositionId(positionId).stream()
                .filter(Nomination::isActiveCandidate)
                .map(Nomination::getNomineeId)
                .collect(Collectors.toList());
    }

    private String recusalReason(String evaluatorId, Nomination candidacy) {
        if (evaluatorId.equals(candidacy.getNomineeId())) {
            return RECUSAL_SELF;
        }
        if (candidacy.allNominatorIds().contains(evaluatorId)) {
            return RECUSAL_NOMINATOR;
        }
        if (evaluationRepository.hasDeclaredConflict(evaluatorId, candidacy.getNomineeId())) {
            return RECUSAL_DECLARED;
        }
        return null;
    }

    private boolean isActiveCandidate(String positionId, String candidateId) {
        return nominationRepository.findByPositionAndNominee(positionId, candidateId)
                .map(Nomination::isActiveCandidate)
                .orElse(false);
    }

    private void validateRubric(List<CriterionDefinition> definitions, ChapterPolicy policy, CycleStatus stage) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (definitions == null || definitions.isEmpty()) {
            errors.put("criteria", "at least one criterion is required");
            ValidationException.throwIfAny(errors, stage);
        }
        Set<String> names = new HashSet<>();
        double total = 0;
        for (int i = 0; i < definitions.size(); i++) {
            CriterionDefinition definition = definitions.get(i);
            if (definition.getName() == null || definition.getName().isBlank()) {
                errors.put("criteria[" + i + "].name", "is required");
            } else if (!names.add(definition.getName().trim().toLowerCase(Locale.ROOT))) {
                errors.put("criteria[" + i + "].name", "duplicate criterion name");
            }
            if (definition.getWeight() < 0 || definition.getWeight() > 1) {
                errors.put("criteria[" + i + "].weight", "must be between 0 and 1");
            }
            total += definition.getWeight();
        }
        if (Math.abs(total - 1.0) > policy.weightTolerance()) {
            errors.put("criteria", "weights must sum to 1.0, got " + total);
        }
        ValidationException.throwIfAny(errors, stage);
    }
}
