package com.lodestar.succession.evaluation;

import com.lodestar.succession.domain.model.EvaluationCriterion;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.EvaluatorAssignment;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.policy.ChapterPolicy;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns raw scores into ranked totals.
 * <p>
 * {@code total = sum(weight * mean(non-recused scores for the criterion)) / scaleMax * 100}. A
 * criterion nobody scored contributes zero. Ranking order: total descending, unanimity count
 * descending, earliest nomination, candidate id.
 */
@Component
public class ScoreAggregator {

    private static final Comparator<CandidateScore> RANKING = Comparator
            .comparingDouble(CandidateScore::getTotal).reversed()
            .thenComparing(Comparator.comparingInt(CandidateScore::getUnanimityCount).reversed())
            .thenComparing(CandidateScore::getNominatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CandidateScore::getCandidateId);

    public List<CandidateScore> rank(List<EvaluationCriterion> rubric,
                                     List<Nomination> candidates,
                                     List<EvaluatorAssignment> assignments,
                                     List<EvaluationScore> scores,
                                     ChapterPolicy policy) {
        Set<String> recusedPairs = assignments.stream()
                .filter(EvaluatorAssignment::isRecused)
                .map(assignment -> pair(assignment.getEvaluatorId(), assignment.getCandidateId()))
                .collect(Collectors.toSet());
        Set<String> assignedPairs = assignments.stream()
                .filter(assignment -> !assignment.isRecused())
                .map(assignment -> pair(assignment.getEvaluatorId(), assignment.getCandidateId()))
                .collect(Collectors.toSet());

        Map<String, List<EvaluationScore>> byCandidate = scores.stream()
                .filter(score -> assignedPairs.contains(pair(score.getEvaluatorId(), score.getCandidateId())))
                .filter(score -> !recusedPairs.contains(pair(score.getEvaluatorId(), score.getCandidateId())))
                .collect(Collectors.groupingBy(EvaluationScore::getCandidateId));

        List<CandidateScore> results = new ArrayList<>();
        for (Nomination candidate : candidates) {
            List<EvaluationScore> candidateScores = byCandidate.getOrDefault(candidate.getNomineeId(), List.of());
            Map<String, Double> means = new LinkedHashMap<>();
            double weighted = 0;
            int unanimity = 0;
            for (EvaluationCriterion criterion : rubric) {
                List<Double> values = candidateScores.stream()
                        .filter(score -> criterion.getId().equals(score.getCriterionId()))
                        .map(EvaluationScore::getRawScore)
                        .collect(Collectors.toList());
                if (values.isEmpty()) {
                    continue;
                }
                double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
                means.put(criterion.getId(), round(mean));
                weighted += criterion.getWeight() * mean;
                if (values.size() > 1 && values.stream().distinct().count() == 1) {
                    unanimity++;
                }
            }
            results.add(CandidateScore.builder()
                    .candidateId(candidate.getNomineeId())
                    .nominationId(candidate.getId())
                    .total(round(weighted / policy.scoreScaleMax() * 100))
                    .criterionMeans(means)
                    .unanimityCount(unanimity)
                    .evaluatorCount((int) candidateScores.stream().map(EvaluationScore::getEvaluatorId).distinct().count())
                    .nominatedAt(candidate.getSubmittedAt())
                    .build());
        }

        results.sort(RANKING);
        for (int i = 0; i < results.size(); i++) {
            results.get(i).setRank(i + 1);
        }
        return results;
    }

    private static String pair(String evaluatorId, String candidateId) {
        return evaluatorId + '|' + candidateId;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
