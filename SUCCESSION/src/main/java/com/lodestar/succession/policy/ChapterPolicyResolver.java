package com.lodestar.succession.policy;

import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.model.SuccessionCycle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link ChapterPolicy} for a cycle: built-in defaults, overlaid with
 * {@code succession.policy}, overlaid with {@code succession.chapters.<chapterId>}.
 */
@Component
@RequiredArgsConstructor
public class ChapterPolicyResolver {

    private final SuccessionProperties properties;

    public ChapterPolicy forCycle(SuccessionCycle cycle) {
        return forChapter(cycle.getChapterId());
    }

    public ChapterPolicy forChapter(String chapterId) {
        ChapterPolicy policy = overlay(ChapterPolicy.defaults(), properties.getPolicy());
        if (chapterId != null) {
            SuccessionProperties.Policy chapterOverrides = properties.getChapters().get(chapterId);
            if (chapterOverrides != null) {
                policy = overlay(policy, chapterOverrides);
            }
        }
        return policy;
    }

    private ChapterPolicy overlay(ChapterPolicy base, SuccessionProperties.Policy overrides) {
        ChapterPolicy.ChapterPolicyBuilder builder = base.toBuilder();
        if (overrides.getQuorumFraction() != null) {
            builder.quorumFraction(overrides.getQuorumFraction());
        }
        if (overrides.getScoreScaleMin() != null) {
            builder.scoreScaleMin(overrides.getScoreScaleMin());
        }
        if (overrides.getScoreScaleMax() != null) {
            builder.scoreScaleMax(overrides.getScoreScaleMax());
        }
        if (overrides.getJustificationMinLength() != null) {
            builder.justificationMinLength(overrides.getJustificationMinLength());
        }
        if (overrides.getJustificationMaxLength() != null) {
            builder.justificationMaxLength(overrides.getJustificationMaxLength());
        }
        if (overrides.getWeightTolerance() != null) {
            builder.weightTolerance(overrides.getWeightTolerance());
        }
        if (overrides.getWithdrawalReasonMinLength() != null) {
            builder.withdrawalReasonMinLength(overrides.getWithdrawalReasonMinLength());
        }
        return builder.build();
    }
}
