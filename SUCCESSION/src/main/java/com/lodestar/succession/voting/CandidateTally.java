package com.lodestar.succession.voting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ballot counts for one candidate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateTally {
    private String candidateId;
    private int yes;
    private int no;
    private int abstain;
    /** Evaluation total used to break yes-count ties */
    private Double evaluationScore;
    /** Cleared quorum: yes reaches the required count and outnumbers no */
    private boolean qualifies;
}
