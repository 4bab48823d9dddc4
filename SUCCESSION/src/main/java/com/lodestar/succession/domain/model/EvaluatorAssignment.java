package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An evaluator assigned to score a candidate. Recused assignments are kept with their reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluatorAssignment {

    private String cycleId;

    private String positionId;

    private String evaluatorId;

    private String candidateId;

    private boolean recused;

    private String recusalReason;

    private String assignedBy;

    private Instant assignedAt;
}
