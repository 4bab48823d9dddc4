package com.lodestar.succession.approach;

import com.lodestar.succession.SuccessionTestFixture;
import com.lodestar.succession.SuccessionTestFixture.Pipeline;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CandidateApproach;
import com.lodestar.succession.domain.model.CandidateApproach.ResponseStatus;
import com.lodestar.succession.notification.NotificationTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ApproachService}.
 */
class ApproachServiceTest {

    private SuccessionTestFixture fixture;
    private Pipeline pipeline;

    @BeforeEach
    void setUp() {
        fixture = new SuccessionTestFixture();
    }

    private ApproachRequest request(String nomineeId) {
        return ApproachRequest.builder()
                .positionId(pipeline.positionId())
                .nomineeId(nomineeId)
                .notes("Called after the committee meeting")
                .build();
    }

    private CandidateApproach approach(String nomineeId) {
        return fixture.approachService.recordApproach(fixture.admin, pipeline.cycleId(), request(nomineeId));
    }

    @Nested
    @DisplayName("Recording approaches")
    class RecordTests {

        @BeforeEach
        void startSelection() {
            pipeline = fixture.startSelection();
        }

        @Test
        @DisplayName("should record a pending approach and notify the candidate")
        void recordsApproach() {
            CandidateApproach approach = approach("n2");

            assertThat(approach.getResponseStatus()).isEqualTo(ResponseStatus.PENDING);
            assertThat(approach.getApproachedBy()).isEqualTo(SuccessionTestFixture.ADMIN_ID);
            assertThat(fixture.notifications.recipients(NotificationTemplate.CANDIDATE_APPROACHED))
                    .containsExactly("n2");
            assertThat(fixture.audit(pipeline.cycleId(), "approach.create")).hasSize(1);
        }

        @Test
        @DisplayName("should approach a candidate only once per position")
        void oncePerPosition() {
            approach("n2");

            assertThatThrownBy(() -> approach("n2"))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("already approached");
            assertThat(fixture.approachService.listApproaches(pipeline.cycleId())).hasSize(1);
        }

        @Test
        @DisplayName("should only approach rostered candidates")
        void rosteredOnly() {
            assertThatThrownBy(() -> approach("m1"))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getFieldErrors()).containsKey("nomineeId"));
            assertThatThrownBy(() -> fixture.approachService.recordApproach(Actor.member("c1"), pipeline.cycleId(),
                    request("n2")))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Test
    @DisplayName("should refuse approaches before selection")
    void beforeSelection() {
        pipeline = fixture.startEvaluations();

        assertThatThrownBy(() -> approach("n2"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("EVALUATIONS");
    }

    @Nested
    @DisplayName("Responses")
    class ResponseTests {

        private CandidateApproach approach;

        @BeforeEach
        void approachN2() {
            pipeline = fixture.startSelection();
            approach = approach("n2");
        }

        @Test
        @DisplayName("should let the candidate accept")
        void candidateAccepts() {
            CandidateApproach accepted = fixture.approachService.respond(Actor.member("n2"), approach.getId(),
                    ResponseStatus.ACCEPTED, null, null);

            assertThat(accepted.getResponseStatus()).isEqualTo(ResponseStatus.ACCEPTED);
            assertThat(accepted.getResponseDate()).isEqualTo(fixture.clock.instant());
            assertThat(accepted.getNotes()).isEqualTo("Called after the committee meeting");
            assertThat(fixture.audit(pipeline.cycleId(), "approach.respond")).hasSize(1);
        }

        @Test
        @DisplayName("should require conditions for a conditional answer")
        void conditionalNeedsText() {
            assertThatThrownBy(() -> fixture.approachService.respond(Actor.member("n2"), approach.getId(),
                    ResponseStatus.CONDITIONAL, " ", null))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getFieldErrors()).containsKey("conditionsText"));

            CandidateApproach conditional = fixture.approachService.respond(Actor.member("n2"), approach.getId(),
                    ResponseStatus.CONDITIONAL, "Only if the treasurer role is split", null);

            assertThat(conditional.getConditionsText()).isEqualTo("Only if the treasurer role is split");
        }

        @Test
        @DisplayName("should not let other members answer for the candidate")
        void onlyCandidateOrAdmin() {
            assertThatThrownBy(() -> fixture.approachService.respond(Actor.member("n1"), approach.getId(),
                    ResponseStatus.DECLINED, null, null))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        @DisplayName("should delete only unanswered approaches")
        void deleteUnansweredOnly() {
            fixture.approachService.respond(fixture.admin, approach.getId(), ResponseStatus.DECLINED, null,
                    "Declined by phone");
            CandidateApproach pending = approach("n1");

            assertThatThrownBy(() -> fixture.approachService.deleteApproach(fixture.admin, approach.getId()))
                    .isInstanceOf(ConflictException.class);
            fixture.approachService.deleteApproach(fixture.admin, pending.getId());

            assertThat(fixture.approachService.listApproaches(pipeline.cycleId()))
                    .extracting(CandidateApproach::getNomineeId)
                    .containsExactly("n2");
        }
    }
}
