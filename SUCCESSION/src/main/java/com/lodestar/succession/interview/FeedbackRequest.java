package com.lodestar.succession.interview;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {
    private int overallRating;
    private String strengths;
    private String areasForImprovement;
    private String recommendation;
    private String notes;
}
