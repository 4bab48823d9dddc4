package com.lodestar.succession.policy;

import com.lodestar.succession.config.SuccessionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ChapterPolicyResolver}.
 */
class ChapterPolicyResolverTest {

    private SuccessionProperties properties;
    private ChapterPolicyResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new SuccessionProperties();
        resolver = new ChapterPolicyResolver(properties);
    }

    @Test
    @DisplayName("should fall back to the built-in defaults")
    void defaults() {
        assertThat(resolver.forChapter("chapter-1")).isEqualTo(ChapterPolicy.defaults());
    }

    @Test
    @DisplayName("should overlay global settings and then chapter settings field by field")
    void overlays() {
        properties.getPolicy().setQuorumFraction(0.6);
        properties.getPolicy().setJustificationMinLength(50);
        SuccessionProperties.Policy chapter = new SuccessionProperties.Policy();
        chapter.setQuorumFraction(0.75);
        properties.getChapters().put("chapter-2", chapter);

        ChapterPolicy global = resolver.forChapter("chapter-1");
        ChapterPolicy overridden = resolver.forChapter("chapter-2");

        assertThat(global.quorumFraction()).isEqualTo(0.6);
        assertThat(overridden.quorumFraction()).isEqualTo(0.75);
        assertThat(overridden.justificationMinLength()).isEqualTo(50);
        assertThat(overridden.scoreScaleMax()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("should round the required yes votes up")
    void requiredYesVotes() {
        ChapterPolicy policy = ChapterPolicy.defaults();

        assertThat(policy.requiredYesVotes(3)).isEqualTo(2);
        assertThat(policy.requiredYesVotes(4)).isEqualTo(2);
        assertThat(policy.requiredYesVotes(5)).isEqualTo(3);
        assertThat(policy.toBuilder().quorumFraction(2.0 / 3).build().requiredYesVotes(6)).isEqualTo(4);
    }
}
