package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A committee member's ballot on one nominee. Unique per (position, nominee, voter).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vote {

    private String meetingId;

    private String cycleId;

    private String positionId;

    private String nomineeId;

    private String voterId;

    private VoteValue value;

    private String comments;

    private Instant castAt;

    public enum VoteValue {
        YES,
        NO,
        ABSTAIN
    }
}
