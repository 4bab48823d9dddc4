package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structured eligibility predicate attached to a position.
 * <p>
 * Threshold fields left {@code null} are not checked. Weights are percentages; when any weight
 * is set they must sum to 100 and the weighted score must reach {@link #minimumScore}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EligibilityCriteria {

    /** Minimum membership tenure in years */
    private Double minTenureYears;

    /** Minimum number of events attended */
    private Integer minEventsAttended;

    /** Minimum number of training sessions attended */
    private Integer minTrainingSessions;

    /** Minimum number of peer nominations received */
    private Integer minPeerNominations;

    /** Roles the member must have held before (any one of them) */
    @Builder.Default
    private Set<String> requiredPriorRoles = new LinkedHashSet<>();

    /** Skills considered for the skills score */
    @Builder.Default
    private Set<String> requiredSkills = new LinkedHashSet<>();

    /** Member must have held at least one leadership position */
    private boolean requireLeadershipExperience;

    private double tenureWeight;
    private double eventsWeight;
    private double leadershipWeight;
    private double skillsWeight;

    /** Weighted score (0-100) needed when weights are configured */
    private double minimumScore;

    public double totalWeight() {
        return tenureWeight + eventsWeight + leadershipWeight + skillsWeight;
    }

    public boolean isWeighted() {
        return totalWeight() > 0;
    }
}
