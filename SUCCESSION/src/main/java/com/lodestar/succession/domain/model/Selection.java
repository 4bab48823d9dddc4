package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The admin-confirmed decision for a position. At most one active selection per position.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Selection {

    private String id;

    private String cycleId;

    private String positionId;

    private String candidateId;

    private String rationale;

    private String decidedBy;

    private Instant decidedAt;

    /** Candidate did not clear quorum; rationale carries the override reason */
    private boolean override;

    @Builder.Default
    private boolean active = true;

    private Instant revokedAt;

    private String revokedBy;

    private String revocationReason;
}
