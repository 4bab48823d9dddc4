package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of an admin sounding out a shortlisted candidate on whether they would take the
 * position. Unique per (position, nominee).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CandidateApproach {

    private String id;

    private String cycleId;

    private String positionId;

    private String nomineeId;

    private String approachedBy;

    private Instant approachedAt;

    @Builder.Default
    private ResponseStatus responseStatus = ResponseStatus.PENDING;

    private Instant responseDate;

    /** Required when the response is conditional */
    private String conditionsText;

    private String notes;

    private Instant updatedAt;

    public enum ResponseStatus {
        PENDING,
        ACCEPTED,
        DECLINED,
        CONDITIONAL
    }
}
