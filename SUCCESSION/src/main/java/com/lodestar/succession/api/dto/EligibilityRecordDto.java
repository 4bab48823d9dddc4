package com.lodestar.succession.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lodestar.succession.domain.model.EligibilityRecord;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EligibilityRecordDto {
    private String positionId;
    private String memberId;
    private String status;
    private Double score;
    private List<String> reasons;
    private List<EligibilityRecord.CriterionCheck> checks;
    private Instant computedAt;
}
