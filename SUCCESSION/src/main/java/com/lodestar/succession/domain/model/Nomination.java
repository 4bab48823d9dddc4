package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A candidacy for a position. Unique per (position, nominee); third-party nominations,
 * self-applications and secondments all share this type and differ by {@link #source}.
 * <p>
 * Unrelated to award nominations, which live in a different module.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Nomination {

    private String id;

    private String cycleId;

    private String positionId;

    private CandidacySource source;

    /** Member who submitted first; equals nominee for applications */
    private String nominatorId;

    /** Further members who nominated the same candidate */
    @Builder.Default
    private Set<String> coNominatorIds = new LinkedHashSet<>();

    private String nomineeId;

    private String justification;

    @Builder.Default
    private List<EvidenceItem> supportingEvidence = new ArrayList<>();

    @Builder.Default
    private CandidacyStatus status = CandidacyStatus.SUBMITTED;

    /** Only meaningful for secondments */
    private ConsentStatus consentStatus;

    /** Eligibility was not yet known when the candidacy was accepted */
    private boolean eligibilityPending;

    private String withdrawalReason;

    private String disqualificationReason;

    private Instant submittedAt;

    private Instant updatedAt;

    /**
     * Whether this candidacy is on the ballot: submitted and, for secondments, consented to.
     */
    public boolean isActiveCandidate() {
        if (status != CandidacyStatus.SUBMITTED) {
            return false;
        }
        return source != CandidacySource.SECONDMENT || consentStatus == ConsentStatus.ACCEPTED;
    }

    /**
     * Everyone who put this nominee forward.
     */
    public Set<String> allNominatorIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (nominatorId != null) {
            ids.add(nominatorId);
        }
        ids.addAll(coNominatorIds);
        return ids;
    }

    public enum CandidacySource {
        /** Third party puts a member forward */
        NOMINATION,
        /** Member applies for themselves */
        APPLICATION,
        /** Member is proposed and must consent */
        SECONDMENT
    }

    public enum CandidacyStatus {
        SUBMITTED,
        WITHDRAWN,
        DISQUALIFIED
    }

    public enum ConsentStatus {
        PENDING,
        ACCEPTED,
        DECLINED
    }

    /**
     * One piece of supporting evidence. Equality drives de-duplication on merge.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EvidenceItem {
        private String type;
        private String title;
        private String content;
        private String url;
    }
}
