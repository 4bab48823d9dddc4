package com.lodestar.succession.domain.service;

import com.lodestar.succession.domain.model.EligibilityCriteria;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin input for adding or editing a position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionDraft {
    private String title;
    private String description;
    private int hierarchyLevel;
    @Builder.Default
    private int numberOfOpenings = 1;
    private EligibilityCriteria eligibilityCriteria;
}
