package com.lodestar.succession.eligibility;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one eligibility recompute over a cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputeReport {

    private String cycleId;

    /** (position, member) pairs evaluated */
    private int evaluated;

    /** Records whose inputs changed and were rewritten */
    private int changed;

    /** Records left pending because member data was unavailable */
    private int pending;

    @Builder.Default
    private List<MemberPosition> newlyEligible = new ArrayList<>();

    /** Active candidacies whose nominee is no longer eligible; an admin must act */
    @Builder.Default
    private List<DisqualificationRecommendation> recommendations = new ArrayList<>();

    private Instant computedAt;

    public record MemberPosition(String positionId, String memberId) {
    }

    public record DisqualificationRecommendation(String nominationId, String positionId, String nomineeId,
                                                 List<String> reasons) {
    }
}
