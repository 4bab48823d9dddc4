package com.lodestar.succession.automation;

import com.lodestar.succession.SuccessionTestFixture;
import com.lodestar.succession.SuccessionTestFixture.Pipeline;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.notification.NotificationTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AutomationScheduler}.
 */
class AutomationSchedulerTest {

    private SuccessionTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SuccessionTestFixture();
    }

    private void deadline(String cycleId, CycleStatus stage, Duration fromNow) {
        fixture.adminService.setDeadlines(fixture.admin, cycleId, Map.of(stage, fixture.clock.instant().plus(fromNow)));
    }

    @Nested
    @DisplayName("Deadlines")
    class DeadlineTests {

        @Test
        @DisplayName("should advance a cycle once its stage deadline has passed")
        void advancesOnDeadline() {
            Pipeline pipeline = fixture.startEvaluations();
            fixture.scoreAll(pipeline);
            deadline(pipeline.cycleId(), CycleStatus.EVALUATIONS, Duration.ofHours(48));

            fixture.automationScheduler.tick();
            assertThat(fixture.cycle(pipeline.cycleId()).getStatus()).isEqualTo(CycleStatus.EVALUATIONS);

            fixture.clock.advance(Duration.ofHours(49));
            fixture.automationScheduler.tick();

            SuccessionCycle cycle = fixture.cycle(pipeline.cycleId());
            assertThat(cycle.getStatus()).isEqualTo(CycleStatus.EVALUATIONS_CLOSED);
            assertThat(cycle.getStatusHistory().get(cycle.getStatusHistory().size() - 1).getActorId()).isEqualTo("system");
            AutomationStatus status = fixture.automationScheduler.status(pipeline.cycleId());
            assertThat(status.consecutiveFailures()).isZero();
            assertThat(status.lastSuccessAt()).isEqualTo(fixture.clock.instant());
        }

        @Test
        @DisplayName("should warn once inside the warning window and remind evaluators with open scores")
        void warnsOnce() {
            Pipeline pipeline = fixture.startEvaluations();
            fixture.score(pipeline, "e1", "n1", 8, 6);
            fixture.notifications.clear();
            deadline(pipeline.cycleId(), CycleStatus.EVALUATIONS, Duration.ofHours(12));

            fixture.automationScheduler.tick();
            fixture.clock.advance(Duration.ofHours(1));
            fixture.automationScheduler.tick();

            assertThat(fixture.notifications.recipients(NotificationTemplate.PHASE_DEADLINE_WARNING))
                    .containsExactly(SuccessionTestFixture.ADMIN_ID);
            assertThat(fixture.notifications.recipients(NotificationTemplate.SCORES_INCOMPLETE))
                    .containsExactlyInAnyOrder("e1", "e2");
            assertThat(fixture.automationScheduler.status(pipeline.cycleId()).warnedStages())
                    .containsExactly(CycleStatus.EVALUATIONS);
        }

        @Test
        @DisplayName("should warn again when a revert re-enters an already warned stage")
        void warnsAgainAfterRevert() {
            Pipeline pipeline = fixture.startEvaluations();
            deadline(pipeline.cycleId(), CycleStatus.EVALUATIONS, Duration.ofHours(12));
            fixture.automationScheduler.tick();
            fixture.stateMachine.forceTransition(fixture.admin, pipeline.cycleId(), CycleStatus.EVALUATIONS_CLOSED,
                    null, "Board meeting moved forward");

            fixture.stateMachine.revert(fixture.admin, pipeline.cycleId(), null, "Two evaluators asked for more time");

            assertThat(fixture.automationScheduler.status(pipeline.cycleId()).warnedStages()).isEmpty();
            fixture.notifications.clear();
            fixture.automationScheduler.tick();
            assertThat(fixture.notifications.recipients(NotificationTemplate.PHASE_DEADLINE_WARNING))
                    .containsExactly(SuccessionTestFixture.ADMIN_ID);
        }

        @Test
        @DisplayName("should leave manual stages alone when their deadline passes")
        void manualStageSkipped() {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");
            deadline(cycle.getId(), CycleStatus.DRAFT, Duration.ofHours(1));
            fixture.clock.advance(Duration.ofHours(2));

            fixture.automationScheduler.tick();

            assertThat(fixture.cycle(cycle.getId()).getStatus()).isEqualTo(CycleStatus.DRAFT);
            assertThat(fixture.automationScheduler.status(cycle.getId()).consecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("should do nothing on the scheduled tick when automation is disabled")
        void disabled() {
            SuccessionCycle cycle = fixture.createCycle();
            fixture.addPosition(cycle.getId(), "Treasurer");
            fixture.transition(cycle.getId(), CycleStatus.ACTIVE);
            deadline(cycle.getId(), CycleStatus.ACTIVE, Duration.ofHours(1));
            fixture.clock.advance(Duration.ofHours(2));
            fixture.properties.getAutomation().setEnabled(false);

            fixture.automationScheduler.scheduledTick();

            assertThat(fixture.cycle(cycle.getId()).getStatus()).isEqualTo(CycleStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        private Pipeline pipeline;

        @BeforeEach
        void blockedCycle() {
            pipeline = fixture.startEvaluations();
            fixture.score(pipeline, "e1", "n1", 8, 6);
            deadline(pipeline.cycleId(), CycleStatus.EVALUATIONS, Duration.ofHours(1));
            fixture.clock.advance(Duration.ofHours(2));
            fixture.notifications.clear();
        }

        @Test
        @DisplayName("should escalate to admins exactly once when the threshold is reached")
        void escalatesOnce() {
            for (int i = 0; i < 4; i++) {
                fixture.automationScheduler.tick();
            }

            AutomationStatus status = fixture.automationScheduler.status(pipeline.cycleId());
            assertThat(status.consecutiveFailures()).isEqualTo(4);
            assertThat(status.escalated()).isTrue();
            assertThat(status.lastError()).contains("scores-complete");
            assertThat(fixture.notifications.recipients(NotificationTemplate.AUTOMATION_ESCALATED))
                    .containsExactly(SuccessionTestFixture.ADMIN_ID);
            assertThat(fixture.cycle(pipeline.cycleId()).getStatus()).isEqualTo(CycleStatus.EVALUATIONS);
        }

        @Test
        @DisplayName("should clear failures once the transition goes through")
        void recovers() {
            fixture.automationScheduler.tick();
            fixture.automationScheduler.tick();

            fixture.scoreAll(pipeline);
            fixture.automationScheduler.tick();

            AutomationStatus status = fixture.automationScheduler.status(pipeline.cycleId());
            assertThat(status.consecutiveFailures()).isZero();
            assertThat(status.escalated()).isFalse();
            assertThat(fixture.notifications.sent(NotificationTemplate.AUTOMATION_ESCALATED)).isEmpty();
            assertThat(fixture.cycle(pipeline.cycleId()).getStatus()).isEqualTo(CycleStatus.EVALUATIONS_CLOSED);
        }

        @Test
        @DisplayName("should keep processing other cycles when one fails")
        void isolatesCycles() {
            SuccessionCycle other = fixture.createCycle();
            fixture.addPosition(other.getId(), "Treasurer");
            fixture.transition(other.getId(), CycleStatus.ACTIVE);
            deadline(other.getId(), CycleStatus.ACTIVE, Duration.ofMinutes(30));
            fixture.clock.advance(Duration.ofHours(1));

            fixture.automationScheduler.tick();

            assertThat(fixture.cycle(pipeline.cycleId()).getStatus()).isEqualTo(CycleStatus.EVALUATIONS);
            assertThat(fixture.cycle(other.getId()).getStatus()).isEqualTo(CycleStatus.NOMINATIONS_OPEN);
            assertThat(fixture.automationScheduler.status(pipeline.cycleId()).consecutiveFailures()).isEqualTo(1);
        }
    }
}
