package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived qualification of a member for a position. Always recomputable from the criteria and
 * the member's activity, never edited by hand.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EligibilityRecord {

    private String positionId;

    private String memberId;

    private EligibilityStatus status;

    /** Human-readable unmet criteria, e.g. "tenure 2.1y < required 3.0y" */
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    @Builder.Default
    private List<CriterionCheck> checks = new ArrayList<>();

    /** Weighted score 0-100, null when the criteria carry no weights */
    private Double score;

    /** Hash of the inputs the record was computed from */
    private String inputFingerprint;

    private Instant computedAt;

    public boolean isEligible() {
        return status == EligibilityStatus.ELIGIBLE;
    }

    public enum EligibilityStatus {
        ELIGIBLE,
        INELIGIBLE,
        /** Member data could not be retrieved; not a negative verdict */
        PENDING
    }

    /**
     * Outcome of one criterion.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CriterionCheck {
        private String criterion;
        private String actual;
        private String required;
        private boolean passed;
        /** actual - required for numeric criteria */
        private Double margin;
    }
}
