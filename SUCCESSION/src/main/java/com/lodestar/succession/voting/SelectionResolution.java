package com.lodestar.succession.voting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Voting outcome for a position. Never a decision by itself: the admin confirms a selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionResolution {

    private String positionId;

    private int seatedCommitteeSize;

    private int requiredYesVotes;

    /** All candidates, qualifiers first, by yes count then evaluation score */
    @Builder.Default
    private List<CandidateTally> tallies = new ArrayList<>();

    /** Qualifying candidate ids in rank order */
    @Builder.Default
    private List<String> qualifying = new ArrayList<>();

    /** Set only when exactly one candidate qualifies */
    private String soleQualifier;

    /** More than one candidate qualifies, or none does */
    private boolean requiresAdminDecision;
}
