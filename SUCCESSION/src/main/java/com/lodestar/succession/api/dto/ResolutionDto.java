package com.lodestar.succession.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lodestar.succession.domain.model.Vote;
import com.lodestar.succession.voting.CandidateTally;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Voting outcome of a position. Individual ballots are admin-only.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResolutionDto {
    private String positionId;
    private Integer requiredYesVotes;
    private List<CandidateTally> candidateTallies;
    private List<String> qualifying;
    private Boolean requiresAdminDecision;
    private List<Vote> ballots;
}
