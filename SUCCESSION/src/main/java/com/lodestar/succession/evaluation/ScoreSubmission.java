package com.lodestar.succession.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A raw score for one (evaluator, candidate, criterion) key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreSubmission {

    private String positionId;

    /** Must equal the acting member when set */
    private String evaluatorId;

    private String candidateId;

    private String criterionId;

    private double rawScore;

    private String comments;
}
