package com.lodestar.succession.evaluation;

import java.util.List;

/**
 * A non-recused (evaluator, candidate) pair still missing scores.
 */
public record OutstandingScore(String positionId, String evaluatorId, String candidateId, List<String> missingCriterionIds) {
}
