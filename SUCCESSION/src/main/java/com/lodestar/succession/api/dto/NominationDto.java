package com.lodestar.succession.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lodestar.succession.domain.model.Nomination;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Candidacy as shown to a particular viewer. Fields the viewer may not see are left out.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NominationDto {
    private String id;
    private String positionId;
    private String nomineeId;
    private String source;
    private String status;
    private String consentStatus;
    private Set<String> nominatorIds;
    private String justification;
    private List<Nomination.EvidenceItem> evidence;
    private Instant submittedAt;
    private String withdrawalReason;
    private String disqualificationReason;
    private Boolean eligibilityPending;
}
