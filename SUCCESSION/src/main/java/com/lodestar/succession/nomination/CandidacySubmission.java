package com.lodestar.succession.nomination;

import com.lodestar.succession.domain.model.Nomination;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input for a nomination, application or secondment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidacySubmission {

    private String positionId;

    /** Ignored for applications, where the nominee is the acting member */
    private String nomineeId;

    private String justification;

    @Builder.Default
    private List<Nomination.EvidenceItem> evidence = new ArrayList<>();
}
