package com.lodestar.succession.lifecycle;

import com.lodestar.succession.SuccessionTestFixture;
import com.lodestar.succession.SuccessionTestFixture.Pipeline;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.StateTransitionException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.model.Vote.VoteValue;
import com.lodestar.succession.nomination.CandidacySubmission;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.voting.BallotRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Unit tests for {@link CycleStateMachine}.
 */
class CycleStateMachineTest {

    private SuccessionTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SuccessionTestFixture();
    }

    private static void assertGuard(Throwable thrown, String guard) {
        assertThat(thrown).isInstanceOfSatisfying(StateTransitionException.class,
                e -> assertThat(e.getGuard()).isEqualTo(guard));
    }

    @Nested
    @DisplayName("Transition table")
    class TableTests {

        @Test
        @DisplayName("should reject an edge that is not on the forward path")
        void illegalEdge() {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");

            Throwable thrown = catchThrowable(
                    () -> fixture.transition(cycle.getId(), CycleStatus.NOMINATIONS_OPEN));

            assertGuard(thrown, CycleStateMachine.GUARD_TRANSITION_TABLE);
            assertThat(fixture.cycle(cycle.getId()).getStatus()).isEqualTo(CycleStatus.DRAFT);
        }

        @Test
        @DisplayName("should refuse activation without an active position, even when forced")
        void noPosition() {
            SuccessionCycle cycle = fixture.createCycle();

            assertGuard(catchThrowable(
                    () -> fixture.transition(cycle.getId(), CycleStatus.ACTIVE)), CycleGuards.ACTIVE_POSITION_PRESENT);
            assertGuard(catchThrowable(
                    () -> fixture.stateMachine.forceTransition(fixture.admin, cycle.getId(), CycleStatus.ACTIVE, null,
                            "Positions will be added later")), CycleGuards.ACTIVE_POSITION_PRESENT);
        }

        @Test
        @DisplayName("should advance to the next status and record it in the history")
        void advance() {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");

            SuccessionCycle active = fixture.stateMachine.advance(fixture.admin, cycle.getId(), null);

            assertThat(active.getStatus()).isEqualTo(CycleStatus.ACTIVE);
            assertThat(active.getStatusHistory()).singleElement()
                    .satisfies(change -> {
                        assertThat(change.getFrom()).isEqualTo(CycleStatus.DRAFT);
                        assertThat(change.getTo()).isEqualTo(CycleStatus.ACTIVE);
                        assertThat(change.getActorId()).isEqualTo(SuccessionTestFixture.ADMIN_ID);
                    });
            assertThat(fixture.audit(cycle.getId(), "cycle.transition")).hasSize(1);
        }

        @Test
        @DisplayName("should route through the applications phase when it is enabled")
        void applicationsBranch() {
            Pipeline pipeline = fixture.startEvaluations();
            fixture.stateMachine.revert(fixture.admin, pipeline.cycleId(), null, "Open applications as well");
            fixture.adminService.setApplicationsPhase(fixture.admin, pipeline.cycleId(), true);

            assertThat(fixture.stateMachine.advance(fixture.admin, pipeline.cycleId(), null).getStatus())
                    .isEqualTo(CycleStatus.APPLICATIONS_OPEN);
            assertThat(fixture.stateMachine.advance(fixture.admin, pipeline.cycleId(), null).getStatus())
                    .isEqualTo(CycleStatus.APPLICATIONS_CLOSED);
            assertThat(fixture.stateMachine.advance(fixture.admin, pipeline.cycleId(), null).getStatus())
                    .isEqualTo(CycleStatus.EVALUATIONS);
        }

        @Test
        @DisplayName("should only let admins move a cycle")
        void adminOnly() {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");

            assertThatThrownBy(() -> fixture.stateMachine.transition(Actor.member("m1"), cycle.getId(),
                    CycleStatus.ACTIVE, null))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Nested
    @DisplayName("Guards and overrides")
    class GuardTests {

        @Test
        @DisplayName("should block closing evaluations with missing scores and leave the cycle untouched")
        void missingScoresBlock() {
            Pipeline pipeline = fixture.startEvaluations();
            fixture.score(pipeline, "e1", "n1", 8, 6);
            SuccessionCycle before = fixture.cycle(pipeline.cycleId());

            assertGuard(catchThrowable(
                    () -> fixture.transition(pipeline.cycleId(), CycleStatus.EVALUATIONS_CLOSED)),
                    CycleGuards.SCORES_COMPLETE);

            SuccessionCycle after = fixture.cycle(pipeline.cycleId());
            assertThat(after.getStatus()).isEqualTo(CycleStatus.EVALUATIONS);
            assertThat(after.getVersion()).isEqualTo(before.getVersion());
            assertThat(after.getStatusHistory()).hasSameSizeAs(before.getStatusHistory());
        }

        @Test
        @DisplayName("should let an admin force past missing scores with a reason")
        void forceMissingScores() {
            Pipeline pipeline = fixture.startEvaluations();
            fixture.score(pipeline, "e1", "n1", 8, 6);

            assertThatThrownBy(() -> fixture.stateMachine.forceTransition(fixture.admin, pipeline.cycleId(),
                    CycleStatus.EVALUATIONS_CLOSED, null, " "))
                    .isInstanceOf(ValidationException.class);

            SuccessionCycle forced = fixture.stateMachine.forceTransition(fixture.admin, pipeline.cycleId(),
                    CycleStatus.EVALUATIONS_CLOSED, null, "Evaluator e2 is on extended leave");

            assertThat(forced.getStatus()).isEqualTo(CycleStatus.EVALUATIONS_CLOSED);
            SuccessionCycle.StatusChange last = forced.getStatusHistory().get(forced.getStatusHistory().size() - 1);
            assertThat(last.isOverride()).isTrue();
            assertThat(last.getReason()).isEqualTo("Evaluator e2 is on extended leave");
            assertThat(fixture.audit(pipeline.cycleId(), "cycle.override"))
                    .singleElement()
                    .satisfies(entry -> assertThat(entry.getSummary()).contains(CycleGuards.SCORES_COMPLETE));
        }

        @Test
        @DisplayName("should never bypass a missing rubric")
        void rubricNotOverridable() {
            fixture.member("n1", 3.0);
            fixture.member("m1", 2.0);
            SuccessionCycle cycle = fixture.createCycle();
            Position position = fixture.addPosition(cycle.getId(), "Secretary");
            fixture.transition(cycle.getId(), CycleStatus.ACTIVE);
            fixture.transition(cycle.getId(), CycleStatus.NOMINATIONS_OPEN);
            fixture.nominate(cycle.getId(), position.getId(), "m1", "n1");
            fixture.transition(cycle.getId(), CycleStatus.NOMINATIONS_CLOSED);

            assertGuard(catchThrowable(
                    () -> fixture.stateMachine.forceTransition(fixture.admin, cycle.getId(), CycleStatus.EVALUATIONS,
                            null, "Rubric to follow")), CycleGuards.RUBRIC_DEFINED);
            assertThat(fixture.cycle(cycle.getId()).getStatus()).isEqualTo(CycleStatus.NOMINATIONS_CLOSED);
        }

        @Test
        @DisplayName("should freeze the roster when evaluations start")
        void rosterFrozen() {
            Pipeline pipeline = fixture.startEvaluations();

            assertThat(fixture.cycle(pipeline.cycleId()).frozenRoster(pipeline.positionId()))
                    .containsExactlyInAnyOrder("n1", "n2", "n3");
            assertThat(fixture.notifications.recipients(NotificationTemplate.CANDIDACY_ADVANCED))
                    .containsExactlyInAnyOrder("n1", "n2", "n3");
        }
    }

    @Nested
    @DisplayName("Versions and concurrency")
    class VersionTests {

        @Test
        @DisplayName("should reject a stale expected version")
        void staleVersion() {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");
            long version = fixture.cycle(cycle.getId()).getVersion();

            fixture.stateMachine.transition(fixture.admin, cycle.getId(), CycleStatus.ACTIVE, version);

            assertThatThrownBy(() -> fixture.stateMachine.transition(fixture.admin, cycle.getId(),
                    CycleStatus.NOMINATIONS_OPEN, version))
                    .isInstanceOfSatisfying(ConflictException.class,
                            e -> assertThat(e.getGuard()).isEqualTo(CycleStateMachine.GUARD_VERSION));
        }

        @Test
        @DisplayName("should let exactly one of two concurrent transitions on the same version win")
        void concurrentTransitions() throws Exception {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");
            long version = fixture.cycle(cycle.getId()).getVersion();

            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Callable<SuccessionCycle> attempt = () -> {
                    start.await();
                    return fixture.stateMachine.transition(fixture.admin, cycle.getId(), CycleStatus.ACTIVE, version);
                };
                List<Future<SuccessionCycle>> futures = List.of(executor.submit(attempt), executor.submit(attempt));
                start.countDown();

                int succeeded = 0;
                List<Throwable> failures = new ArrayList<>();
                for (Future<SuccessionCycle> future : futures) {
                    try {
                        future.get(10, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        failures.add(e.getCause());
                    }
                }

                assertThat(succeeded).isEqualTo(1);
                assertThat(failures).singleElement().isInstanceOf(ConflictException.class);
                assertThat(fixture.cycle(cycle.getId()).getVersion()).isEqualTo(version + 1);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Revert")
    class RevertTests {

        @Test
        @DisplayName("should return to the previous status and clear the roster below evaluations")
        void revertClearsRoster() {
            Pipeline pipeline = fixture.startEvaluations();

            SuccessionCycle reverted = fixture.stateMachine.revert(fixture.admin, pipeline.cycleId(), null,
                    "Late nominations accepted by the board");

            assertThat(reverted.getStatus()).isEqualTo(CycleStatus.NOMINATIONS_CLOSED);
            assertThat(reverted.getRosterSnapshot()).isEmpty();
            assertThat(fixture.audit(pipeline.cycleId(), "cycle.revert")).hasSize(1);
        }

        @Test
        @DisplayName("should require an admin and a reason")
        void revertGuards() {
            Pipeline pipeline = fixture.startEvaluations();

            assertThatThrownBy(() -> fixture.stateMachine.revert(Actor.member("m1"), pipeline.cycleId(), null, "why not"))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> fixture.stateMachine.revert(fixture.admin, pipeline.cycleId(), null, ""))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should refuse to revert a draft cycle")
        void revertDraft() {
            SuccessionCycle cycle = fixture.createCycle();

            assertGuard(catchThrowable(
                    () -> fixture.stateMachine.revert(fixture.admin, cycle.getId(), null, "nothing to undo")),
                    CycleStateMachine.GUARD_REVERT);
        }
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        private Pipeline pipeline;

        @BeforeEach
        void selectN2() {
            pipeline = fixture.startSelection();
            String meetingId = fixture.votingMeetingId(pipeline.cycleId());
            for (String voter : List.of("c1", "c2")) {
                fixture.votingService.castVote(Actor.member(voter), pipeline.cycleId(), BallotRequest.builder()
                        .meetingId(meetingId)
                        .positionId(pipeline.positionId())
                        .nomineeId("n2")
                        .value(VoteValue.YES)
                        .build());
            }
            fixture.votingService.recordSelection(fixture.admin, pipeline.cycleId(), pipeline.positionId(), "n2",
                    "Committee majority", null);
            fixture.transition(pipeline.cycleId(), CycleStatus.APPROVAL_PENDING);
        }

        @Test
        @DisplayName("should require an explicit admin to complete the cycle")
        void systemCannotApprove() {
            assertGuard(catchThrowable(
                    () -> fixture.stateMachine.transition(Actor.SYSTEM, pipeline.cycleId(), CycleStatus.COMPLETED, null)),
                    CycleGuards.ADMIN_APPROVAL);
        }

        @Test
        @DisplayName("should publish results and notify selected and unselected candidates")
        void publish() {
            SuccessionCycle completed = fixture.transition(pipeline.cycleId(), CycleStatus.COMPLETED);

            assertThat(completed.isPublished()).isTrue();
            assertThat(completed.getPublishedAt()).isEqualTo(fixture.clock.instant());
            assertThat(fixture.notifications.recipients(NotificationTemplate.YOU_ARE_SELECTED)).containsExactly("n2");
            assertThat(fixture.notifications.recipients(NotificationTemplate.NOT_SELECTED))
                    .containsExactlyInAnyOrder("n1", "n3");
        }

        @Test
        @DisplayName("should unpublish when a completed cycle is reverted")
        void revertUnpublishes() {
            fixture.transition(pipeline.cycleId(), CycleStatus.COMPLETED);

            SuccessionCycle reverted = fixture.stateMachine.revert(fixture.admin, pipeline.cycleId(), null,
                    "Approval given in error");

            assertThat(reverted.getStatus()).isEqualTo(CycleStatus.APPROVAL_PENDING);
            assertThat(reverted.isPublished()).isFalse();
            assertThat(reverted.getPublishedAt()).isNull();
        }
    }

    @Nested
    @DisplayName("Replay")
    class ReplayTests {

        /**
         * Drives a fresh fixture through the applications branch, a revert and into evaluations.
         */
        private SuccessionCycle runScript(SuccessionTestFixture target) {
            for (String member : List.of("n1", "n2", "a1", "m1", "e1", "e2")) {
                target.member(member, 4.0);
            }
            SuccessionCycle cycle = target.createCycle();
            Position position = target.addPosition(cycle.getId(), "Secretary");
            target.adminService.setApplicationsPhase(target.admin, cycle.getId(), true);
            target.transition(cycle.getId(), CycleStatus.ACTIVE);
            target.transition(cycle.getId(), CycleStatus.NOMINATIONS_OPEN);
            target.nominate(cycle.getId(), position.getId(), "m1", "n1");
            target.nominate(cycle.getId(), position.getId(), "m1", "n2");
            target.clock.advance(Duration.ofDays(7));
            target.transition(cycle.getId(), CycleStatus.NOMINATIONS_CLOSED);
            target.transition(cycle.getId(), CycleStatus.APPLICATIONS_OPEN);
            target.clock.advance(Duration.ofHours(2));
            target.stateMachine.revert(target.admin, cycle.getId(), null, "Application form had the wrong deadline");
            target.transition(cycle.getId(), CycleStatus.APPLICATIONS_OPEN);
            target.nominationService.apply(Actor.member("a1"), cycle.getId(), CandidacySubmission.builder()
                    .positionId(position.getId())
                    .nomineeId("a1")
                    .justification(SuccessionTestFixture.justification("a1"))
                    .build());
            target.clock.advance(Duration.ofDays(7));
            target.transition(cycle.getId(), CycleStatus.APPLICATIONS_CLOSED);
            target.defineRubric(position.getId());
            target.evaluationService.assignEvaluators(target.admin, cycle.getId(), position.getId(),
                    List.of("e1", "e2"), null);
            target.transition(cycle.getId(), CycleStatus.EVALUATIONS);
            return target.cycle(cycle.getId());
        }

        @Test
        @DisplayName("should reach the same status, history and version when the same events are replayed")
        void replayIsDeterministic() {
            SuccessionCycle first = runScript(fixture);
            SuccessionCycle second = runScript(new SuccessionTestFixture());

            assertThat(first.getStatus()).isEqualTo(CycleStatus.EVALUATIONS);
            assertThat(second.getStatus()).isEqualTo(first.getStatus());
            assertThat(second.getVersion()).isEqualTo(first.getVersion());
            assertThat(second.getStatusHistory()).isEqualTo(first.getStatusHistory());
            assertThat(first.getStatusHistory()).extracting(SuccessionCycle.StatusChange::isRevert)
                    .containsOnlyOnce(true);
            assertThat(new ArrayList<>(second.getRosterSnapshot().values()))
                    .isEqualTo(new ArrayList<>(first.getRosterSnapshot().values()));
        }
    }
}
