package com.lodestar.succession.voting;

import com.lodestar.succession.domain.model.Vote;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BallotRequest {
    private String meetingId;
    private String positionId;
    private String nomineeId;
    /** Must equal the acting member when set */
    private String voterId;
    private Vote.VoteValue value;
    private String comments;
}
