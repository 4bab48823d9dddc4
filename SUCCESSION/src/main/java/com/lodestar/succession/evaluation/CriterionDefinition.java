package com.lodestar.succession.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One rubric line as submitted by an admin.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriterionDefinition {
    private String name;
    private String description;
    private double weight;
}
