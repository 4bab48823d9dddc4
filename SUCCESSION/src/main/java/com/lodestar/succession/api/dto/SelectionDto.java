package com.lodestar.succession.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectionDto {
    private String id;
    private String positionId;
    private String candidateId;
    private String rationale;
    private String decidedBy;
    private Instant decidedAt;
    private Boolean override;
    private Boolean active;
    private String revocationReason;
}
