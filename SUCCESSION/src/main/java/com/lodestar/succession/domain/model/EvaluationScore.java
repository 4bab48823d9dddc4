package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw score keyed by (evaluator, candidate, criterion). Resubmission overwrites.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationScore {

    private String evaluatorId;

    private String candidateId;

    private String criterionId;

    private String positionId;

    private double rawScore;

    private String comments;

    private Instant submittedAt;
}
