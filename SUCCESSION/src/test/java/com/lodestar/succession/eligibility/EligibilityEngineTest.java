package com.lodestar.succession.eligibility;

import com.lodestar.succession.domain.model.EligibilityCriteria;
import com.lodestar.succession.domain.model.EligibilityRecord;
import com.lodestar.succession.domain.model.EligibilityRecord.EligibilityStatus;
import com.lodestar.succession.domain.model.MemberActivity;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.policy.ChapterPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EligibilityEngine}.
 */
class EligibilityEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private final EligibilityEngine engine = new EligibilityEngine();
    private final ChapterPolicy policy = ChapterPolicy.defaults();

    @Nested
    @DisplayName("Threshold criteria")
    class ThresholdTests {

        @Test
        @DisplayName("should mark member eligible when every threshold is met")
        void eligibleWhenThresholdsMet() {
            Position position = position(EligibilityCriteria.builder()
                    .minTenureYears(2.0)
                    .minEventsAttended(5)
                    .requiredPriorRoles(Set.of("treasurer", "secretary"))
                    .build());

            EligibilityRecord record = engine.evaluate(position, activity(3.0, 8, Set.of("secretary")), policy, NOW);

            assertThat(record.getStatus()).isEqualTo(EligibilityStatus.ELIGIBLE);
            assertThat(record.getReasons()).isEmpty();
            assertThat(record.getChecks()).hasSize(3).allMatch(EligibilityRecord.CriterionCheck::isPassed);
            assertThat(record.getScore()).isNull();
            assertThat(record.getComputedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should explain each unmet threshold")
        void explainsUnmetThresholds() {
            Position position = position(EligibilityCriteria.builder()
                    .minTenureYears(1.0)
                    .minEventsAttended(10)
                    .requireLeadershipExperience(true)
                    .build());

            EligibilityRecord record = engine.evaluate(position, activity(0.5, 10, Set.of()), policy, NOW);

            assertThat(record.getStatus()).isEqualTo(EligibilityStatus.INELIGIBLE);
            assertThat(record.getReasons()).containsExactly(
                    "tenure 0.5y < required 1.0y",
                    "leadership false does not meet required true");
            assertThat(record.getChecks())
                    .filteredOn(check -> check.getCriterion().equals("tenure"))
                    .singleElement()
                    .satisfies(check -> assertThat(check.getMargin()).isEqualTo(-0.5));
        }

        @Test
        @DisplayName("should leave unset thresholds unchecked")
        void unsetThresholdsNotChecked() {
            EligibilityRecord record = engine.evaluate(position(new EligibilityCriteria()),
                    activity(0, 0, Set.of()), policy, NOW);

            assertThat(record.isEligible()).isTrue();
            assertThat(record.getChecks()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Weighted score")
    class WeightedTests {

        private final EligibilityCriteria criteria = EligibilityCriteria.builder()
                .leadershipWeight(40)
                .skillsWeight(60)
                .requiredSkills(Set.of("finance", "outreach"))
                .minimumScore(70)
                .build();

        @Test
        @DisplayName("should pass when the weighted score reaches the minimum")
        void passesAtMinimum() {
            MemberActivity activity = activity(1, 1, Set.of()).toBuilder()
                    .leadershipExperience(true)
                    .skills(Set.of("finance"))
                    .build();

            EligibilityRecord record = engine.evaluate(position(criteria), activity, policy, NOW);

            assertThat(record.isEligible()).isTrue();
            assertThat(record.getScore()).isEqualTo(70.0);
        }

        @Test
        @DisplayName("should fail when the weighted score falls short")
        void failsBelowMinimum() {
            MemberActivity activity = activity(1, 1, Set.of()).toBuilder()
                    .skills(Set.of("finance"))
                    .build();

            EligibilityRecord record = engine.evaluate(position(criteria), activity, policy, NOW);

            assertThat(record.getStatus()).isEqualTo(EligibilityStatus.INELIGIBLE);
            assertThat(record.getScore()).isEqualTo(30.0);
            assertThat(record.getReasons()).singleElement().asString().startsWith("weightedScore 30.0 < required 70.0");
        }
    }

    @Nested
    @DisplayName("Determinism")
    class DeterminismTests {

        @Test
        @DisplayName("should produce identical verdicts and fingerprints for identical inputs")
        void sameInputsSameRecord() {
            Position position = position(EligibilityCriteria.builder().minTenureYears(2.0).build());
            MemberActivity activity = activity(1.5, 3, Set.of("chair"));

            EligibilityRecord first = engine.evaluate(position, activity, policy, NOW);
            EligibilityRecord second = engine.evaluate(position, activity.toBuilder().build(), policy, NOW.plusSeconds(60));

            assertThat(second.getStatus()).isEqualTo(first.getStatus());
            assertThat(second.getReasons()).isEqualTo(first.getReasons());
            assertThat(second.getChecks()).isEqualTo(first.getChecks());
            assertThat(second.getInputFingerprint()).isEqualTo(first.getInputFingerprint());
        }

        @Test
        @DisplayName("should change the fingerprint when member data changes")
        void fingerprintTracksInputs() {
            EligibilityCriteria criteria = EligibilityCriteria.builder().minTenureYears(2.0).build();

            assertThat(engine.fingerprint(criteria, activity(1.5, 3, Set.of())))
                    .isNotEqualTo(engine.fingerprint(criteria, activity(2.5, 3, Set.of())));
        }
    }

    @Nested
    @DisplayName("Criteria validation")
    class ValidationTests {

        @Test
        @DisplayName("should accept criteria without weights")
        void acceptsUnweighted() {
            assertThat(engine.validate(EligibilityCriteria.builder().minTenureYears(1.0).build(), policy)).isEmpty();
        }

        @Test
        @DisplayName("should reject weights that do not sum to 100")
        void rejectsPartialWeights() {
            EligibilityCriteria criteria = EligibilityCriteria.builder().tenureWeight(30).eventsWeight(30).build();

            assertThat(engine.validate(criteria, policy)).containsKey("weights");
        }

        @Test
        @DisplayName("should require skills when skills carry weight")
        void requiresSkillsForSkillsWeight() {
            EligibilityCriteria criteria = EligibilityCriteria.builder().tenureWeight(50).skillsWeight(50).build();

            assertThat(engine.validate(criteria, policy)).containsOnlyKeys("requiredSkills");
        }

        @Test
        @DisplayName("should reject negative thresholds and missing criteria")
        void rejectsNegativeAndMissing() {
            assertThat(engine.validate(EligibilityCriteria.builder().minEventsAttended(-1).build(), policy))
                    .containsKey("minEventsAttended");
            assertThat(engine.validate(null, policy)).containsKey("eligibilityCriteria");
        }
    }

    private static Position position(EligibilityCriteria criteria) {
        return Position.builder()
                .id("pos-1")
                .cycleId("cycle-1")
                .title("Treasurer")
                .eligibilityCriteria(criteria)
                .build();
    }

    private static MemberActivity activity(double tenureYears, int events, Set<String> priorRoles) {
        return MemberActivity.builder()
                .memberId("member-1")
                .tenureYears(tenureYears)
                .eventsAttended(events)
                .priorRoles(priorRoles)
                .build();
    }
}
