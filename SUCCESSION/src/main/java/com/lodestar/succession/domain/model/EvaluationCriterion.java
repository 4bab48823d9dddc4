package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One weighted rubric line for a position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationCriterion {

    private String id;

    private String positionId;

    private String name;

    private String description;

    /** Weight in [0,1]; the weights of a position sum to 1 */
    private double weight;

    private int displayOrder;
}
