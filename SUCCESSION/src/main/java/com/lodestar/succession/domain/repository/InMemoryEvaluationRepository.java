package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.EvaluationCriterion;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.EvaluatorAssignment;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryEvaluationRepository implements EvaluationRepository {

    private final Map<String, List<EvaluationCriterion>> rubrics = new ConcurrentHashMap<>();
    private final Map<String, EvaluatorAssignment> assignments = new ConcurrentHashMap<>();
    private final Map<String, EvaluationScore> scores = new ConcurrentHashMap<>();
    private final Set<String> conflicts = ConcurrentHashMap.newKeySet();

    @Override
    public List<EvaluationCriterion> saveRubric(String positionId, List<EvaluationCriterion> criteria) {
        List<EvaluationCriterion> ordered = criteria.stream()
                .sorted(Comparator.comparingInt(EvaluationCriterion::getDisplayOrder))
                .collect(Collectors.toList());
        rubrics.put(positionId, List.copyOf(ordered));
        return ordered;
    }

    @Override
    public List<EvaluationCriterion> findRubric(String positionId) {
        return rubrics.getOrDefault(positionId, List.of());
    }

    @Override
    public EvaluatorAssignment saveAssignment(EvaluatorAssignment assignment) {
        assignments.put(key(assignment.getPositionId(), assignment.getEvaluatorId(), assignment.getCandidateId()), assignment);
        return assignment;
    }

    @Override
    public Optional<EvaluatorAssignment> findAssignment(String positionId, String evaluatorId, String candidateId) {
        return Optional.ofNullable(assignments.get(key(positionId, evaluatorId, candidateId)));
    }

    @Override
    public List<EvaluatorAssignment> findAssignmentsByPosition(String positionId) {
        return assignments.values().stream()
                .filter(assignment -> positionId.equals(assignment.getPositionId()))
                .sorted(Comparator.comparing(EvaluatorAssignment::getEvaluatorId)
                        .thenComparing(EvaluatorAssignment::getCandidateId))
                .collect(Collectors.toList());
    }

    @Override
    public List<EvaluatorAssignment> findAssignmentsByCycle(String cycleId) {
        return assignments.values().stream()
                .filter(assignment -> cycleId.equals(assignment.getCycleId()))
                .sorted(Comparator.comparing(EvaluatorAssignment::getPositionId)
                        .thenComparing(EvaluatorAssignment::getEvaluatorId)
                        .thenComparing(EvaluatorAssignment::getCandidateId))
                .collect(Collectors.toList());
    }

    @Override
    public EvaluationScore upsertScore(EvaluationScore score) {
        return scores.compute(
                key(score.getEvaluatorId(), score.getCandidateId(), score.getCriterionId()),
                (key, existing) -> score);
    }

    @Override
    public List<EvaluationScore> findScoresByPosition(String positionId) {
        return new ArrayList<>(scores.values()).stream()
                .filter(score -> positionId.equals(score.getPositionId()))
                .collect(Collectors.toList());
    }

    @Override
    public void declareConflict(String memberId, String otherMemberId) {
        conflicts.add(pair(memberId, otherMemberId));
    }

    @Override
    public boolean hasDeclaredConflict(String memberId, String otherMemberId) {
        return conflicts.contains(pair(memberId, otherMemberId));
    }

    private static String key(String first, String second, String third) {
        return first + '|' + second + '|' + third;
    }

    private static String pair(String a, String b) {
        return a.compareTo(b) <= 0 ? a + '|' + b : b + '|' + a;
    }
}
