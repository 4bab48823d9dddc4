package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Feedback of one panelist on one interview slot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterviewFeedback {

    private String slotId;

    private String panelistId;

    /** 1-10 */
    private int overallRating;

    private String strengths;

    private String areasForImprovement;

    private String recommendation;

    private String notes;

    private Instant submittedAt;
}
