package com.lodestar.succession.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackDto {
    private String slotId;
    private String panelistId;
    private Integer overallRating;
    private String strengths;
    private String areasForImprovement;
    private String recommendation;
    private String notes;
    private Instant submittedAt;
}
