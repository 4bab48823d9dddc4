package com.lodestar.succession.visibility;

import java.util.List;

/**
 * Record kinds whose fields are subject to the visibility policy, with their field names.
 */
public enum RecordType {
    NOMINATION(List.of("id", "positionId", "nomineeId", "source", "status", "consentStatus", "nominatorIds",
            "justification", "evidence", "submittedAt", "withdrawalReason", "disqualificationReason",
            "eligibilityPending")),
    ELIGIBILITY(List.of("positionId", "memberId", "status", "score", "reasons", "checks", "computedAt")),
    EVALUATION(List.of("rank", "candidateId", "total", "criterionMeans", "unanimityCount", "evaluatorCount",
            "evaluatorScores")),
    INTERVIEW_FEEDBACK(List.of("slotId", "panelistId", "overallRating", "strengths", "areasForImprovement",
            "recommendation", "notes", "submittedAt")),
    VOTE(List.of("candidateTallies", "qualifying", "requiredYesVotes", "ballots")),
    SELECTION(List.of("id", "positionId", "candidateId", "rationale", "decidedBy", "decidedAt", "override",
            "active", "revocationReason"));

    private final List<String> fields;

    RecordType(List<String> fields) {
        this.fields = fields;
    }

    public List<String> fields() {
        return fields;
    }
}
