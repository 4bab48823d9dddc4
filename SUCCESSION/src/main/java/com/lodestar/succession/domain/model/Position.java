package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A leadership role being filled within a cycle.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;

    private String cycleId;

    private String title;

    private String description;

    /** Seniority, 1 = most senior */
    private int hierarchyLevel;

    @Builder.Default
    private int numberOfOpenings = 1;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private EligibilityCriteria eligibilityCriteria = new EligibilityCriteria();

    private Instant createdAt;

    private Instant updatedAt;
}
