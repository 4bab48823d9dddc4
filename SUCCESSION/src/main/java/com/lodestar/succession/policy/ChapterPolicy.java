package com.lodestar.succession.policy;

import lombok.Builder;

/**
 * Immutable chapter-level thresholds handed to every engine call.
 *
 * @param quorumFraction            fraction of the seated committee whose yes votes are required
 * @param scoreScaleMin             lowest raw evaluation score
 * @param scoreScaleMax             highest raw evaluation score, used to normalize totals to 0-100
 * @param justificationMinLength    minimum candidacy justification length
 * @param justificationMaxLength    maximum candidacy justification length
 * @param weightTolerance           allowed deviation of rubric weights from 1.0
 * @param withdrawalReasonMinLength minimum withdrawal reason length
 */
@Builder(toBuilder = true)
public record ChapterPolicy(
        double quorumFraction,
        double scoreScaleMin,
        double scoreScaleMax,
        int justificationMinLength,
        int justificationMaxLength,
        double weightTolerance,
        int withdrawalReasonMinLength) {

    public static final int MIN_INTERVIEW_MINUTES = 15;
    public static final int MAX_INTERVIEW_MINUTES = 180;
    public static final int MAX_PANEL_SIZE = 10;
    public static final int MIN_FEEDBACK_RATING = 1;
    public static final int MAX_FEEDBACK_RATING = 10;

    public static ChapterPolicy defaults() {
        return ChapterPolicy.builder()
                .quorumFraction(0.5)
                .scoreScaleMin(0)
                .scoreScaleMax(10)
                .justificationMinLength(100)
                .justificationMaxLength(2000)
                .weightTolerance(1e-6)
                .withdrawalReasonMinLength(10)
                .build();
    }

    /**
     * Seats whose yes votes are needed to clear quorum.
     */
    public int requiredYesVotes(int seatedCommitteeSize) {
        return (int) Math.ceil(quorumFraction * seatedCommitteeSize - 1e-9);
    }

    public boolean isScoreInScale(double rawScore) {
        return rawScore >= scoreScaleMin && rawScore <= scoreScaleMax;
    }
}
