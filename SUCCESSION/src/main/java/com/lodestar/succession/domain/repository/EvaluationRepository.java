package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.EvaluationCriterion;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.EvaluatorAssignment;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for rubrics, evaluator assignments, scores and declared conflicts.
 */
public interface EvaluationRepository {

    /**
     * Replace the rubric of a position.
     */
    List<EvaluationCriterion> saveRubric(String positionId, List<EvaluationCriterion> criteria);

    /**
     * Rubric of a position in display order.
     */
    List<EvaluationCriterion> findRubric(String positionId);

    EvaluatorAssignment saveAssignment(EvaluatorAssignment assignment);

    Optional<EvaluatorAssignment> findAssignment(String positionId, String evaluatorId, String candidateId);

    List<EvaluatorAssignment> findAssignmentsByPosition(String positionId);

    List<EvaluatorAssignment> findAssignmentsByCycle(String cycleId);

    /**
     * Insert or overwrite the score stored under (evaluator, candidate, criterion).
     */
    EvaluationScore upsertScore(EvaluationScore score);

    List<EvaluationScore> findScoresByPosition(String positionId);

    /**
     * Record that two members have a declared close relation. Symmetric.
     */
    void declareConflict(String memberId, String otherMemberId);

    boolean hasDeclaredConflict(String memberId, String otherMemberId);
}
