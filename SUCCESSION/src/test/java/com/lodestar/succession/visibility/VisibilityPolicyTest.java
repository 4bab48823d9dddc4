package com.lodestar.succession.visibility;

import com.lodestar.succession.domain.model.CycleStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VisibilityPolicy}.
 */
class VisibilityPolicyTest {

    private final VisibilityPolicy policy = new VisibilityPolicy();

    private Set<String> fields(CycleStatus status, RecordType type, ViewerRole... roles) {
        Set<ViewerRole> held = EnumSet.of(ViewerRole.MEMBER, roles);
        return policy.visibleFields(held, status, type);
    }

    @ParameterizedTest
    @EnumSource(RecordType.class)
    @DisplayName("should show admins every field in any stage")
    void adminSeesAll(RecordType type) {
        assertThat(policy.visibleFields(Set.of(ViewerRole.ADMIN), CycleStatus.DRAFT, type))
                .containsExactlyElementsOf(type.fields());
    }

    @Nested
    @DisplayName("Nominations")
    class NominationTests {

        @Test
        @DisplayName("should hide nominators from the nominee")
        void nomineeDoesNotSeeNominators() {
            assertThat(fields(CycleStatus.NOMINATIONS_OPEN, RecordType.NOMINATION, ViewerRole.NOMINEE))
                    .contains("justification", "consentStatus")
                    .doesNotContain("nominatorIds");
        }

        @Test
        @DisplayName("should show nominators to fellow nominators")
        void nominatorSeesNominators() {
            assertThat(fields(CycleStatus.NOMINATIONS_OPEN, RecordType.NOMINATION, ViewerRole.NOMINATOR))
                    .contains("nominatorIds", "justification")
                    .doesNotContain("disqualificationReason");
        }

        @Test
        @DisplayName("should only show plain members the published outcome")
        void memberOnlyAfterPublication() {
            assertThat(fields(CycleStatus.SELECTION, RecordType.NOMINATION)).isEmpty();
            assertThat(fields(CycleStatus.COMPLETED, RecordType.NOMINATION))
                    .containsExactly("positionId", "nomineeId", "status");
        }

        @Test
        @DisplayName("should merge grants when a viewer holds several roles")
        void unionOfRoles() {
            assertThat(fields(CycleStatus.NOMINATIONS_OPEN, RecordType.NOMINATION, ViewerRole.NOMINEE, ViewerRole.NOMINATOR))
                    .contains("nominatorIds", "disqualificationReason", "eligibilityPending");
        }
    }

    @Nested
    @DisplayName("Evaluations")
    class EvaluationTests {

        @Test
        @DisplayName("should limit evaluators to their own raw scores while scoring is open")
        void evaluatorWhileScoring() {
            assertThat(fields(CycleStatus.EVALUATIONS, RecordType.EVALUATION, ViewerRole.EVALUATOR))
                    .containsExactly("candidateId", "evaluatorScores");
        }

        @Test
        @DisplayName("should show evaluators the aggregate once scoring has closed")
        void evaluatorAfterScoring() {
            assertThat(fields(CycleStatus.EVALUATIONS_CLOSED, RecordType.EVALUATION, ViewerRole.EVALUATOR))
                    .contains("rank", "total", "criterionMeans")
                    .doesNotContain("unanimityCount");
        }

        @Test
        @DisplayName("should show nominees only their published total")
        void nomineeTotals() {
            assertThat(fields(CycleStatus.SELECTION, RecordType.EVALUATION, ViewerRole.NOMINEE)).isEmpty();
            assertThat(fields(CycleStatus.COMPLETED, RecordType.EVALUATION, ViewerRole.NOMINEE))
                    .containsExactly("candidateId", "total");
        }
    }

    @Nested
    @DisplayName("Votes")
    class VoteTests {

        @Test
        @DisplayName("should keep tallies from the committee until voting has closed")
        void talliesAfterVoting() {
            assertThat(policy.canSee(EnumSet.of(ViewerRole.COMMITTEE), CycleStatus.SELECTION, RecordType.VOTE)).isFalse();
            assertThat(fields(CycleStatus.APPROVAL_PENDING, RecordType.VOTE, ViewerRole.COMMITTEE))
                    .containsExactly("candidateTallies", "qualifying", "requiredYesVotes");
        }

        @ParameterizedTest
        @EnumSource(CycleStatus.class)
        @DisplayName("should never reveal individual ballots to non-admins")
        void ballotsSecret(CycleStatus status) {
            Set<ViewerRole> everyoneButAdmin = EnumSet.complementOf(EnumSet.of(ViewerRole.ADMIN));

            assertThat(policy.visibleFields(everyoneButAdmin, status, RecordType.VOTE)).doesNotContain("ballots");
        }
    }
}
