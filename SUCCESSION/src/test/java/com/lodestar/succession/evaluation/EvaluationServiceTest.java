package com.lodestar.succession.evaluation;

import com.lodestar.succession.SuccessionTestFixture;
import com.lodestar.succession.SuccessionTestFixture.Pipeline;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.EvaluatorAssignment;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.notification.NotificationTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EvaluationService}.
 */
class EvaluationServiceTest {

    private SuccessionTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SuccessionTestFixture();
    }

    @Nested
    @DisplayName("Rubric and assignment")
    class SetupTests {

        private SuccessionCycle cycle;
        private Position position;

        @BeforeEach
        void openNominations() {
            fixture.member("n1", 3.0);
            fixture.member("e1", 3.0);
            fixture.member("e2", 3.0);
            cycle = fixture.createCycle();
            position = fixture.addPosition(cycle.getId(), "Treasurer");
            fixture.transition(cycle.getId(), CycleStatus.ACTIVE);
            fixture.transition(cycle.getId(), CycleStatus.NOMINATIONS_OPEN);
            fixture.nominate(cycle.getId(), position.getId(), "e2", "n1");
        }

        @Test
        @DisplayName("should reject rubric weights that do not sum to one")
        void rejectsUnbalancedRubric() {
            assertThatThrownBy(() -> fixture.evaluationService.defineRubric(fixture.admin, position.getId(), List.of(
                    CriterionDefinition.builder().name("impact").weight(0.5).build(),
                    CriterionDefinition.builder().name("initiative").weight(0.3).build())))
                    .isInstanceOf(ValidationException.class);
            assertThat(fixture.evaluationService.getRubric(position.getId())).isEmpty();
        }

        @Test
        @DisplayName("should replace the rubric and keep display order")
        void replacesRubric() {
            fixture.defineRubric(position.getId());

            var rubric = fixture.evaluationService.defineRubric(fixture.admin, position.getId(), List.of(
                    CriterionDefinition.builder().name("vision").weight(1.0).build()));

            assertThat(rubric).singleElement().satisfies(criterion -> {
                assertThat(criterion.getName()).isEqualTo("vision");
                assertThat(criterion.getDisplayOrder()).isEqualTo(1);
            });
            assertThat(fixture.evaluationService.getRubric(position.getId())).hasSize(1);
        }

        @Test
        @DisplayName("should recuse nominators and declared relations automatically")
        void recusesConflicts() {
            fixture.evaluationService.declareConflict(fixture.admin, cycle.getId(), "e1", "n1", "siblings");

            List<EvaluatorAssignment> assignments = fixture.evaluationService.assignEvaluators(fixture.admin,
                    cycle.getId(), position.getId(), List.of("e1", "e2"), null);

            assertThat(assignments).hasSize(2).allMatch(EvaluatorAssignment::isRecused);
            assertThat(fixture.evaluationService.activeEvaluatorCounts(cycle.getId()))
                    .containsEntry(position.getId(), 0L);
        }

        @Test
        @DisplayName("should only let admins assign evaluators")
        void adminAssigns() {
            assertThatThrownBy(() -> fixture.evaluationService.assignEvaluators(Actor.member("e1"), cycle.getId(),
                    position.getId(), List.of("e1"), null))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        private Pipeline pipeline;

        @BeforeEach
        void startEvaluations() {
            pipeline = fixture.startEvaluations();
        }

        @Test
        @DisplayName("should notify assigned evaluators when the roster freezes")
        void notifiesEvaluators() {
            assertThat(fixture.notifications.recipients(NotificationTemplate.ASSIGNED_EVALUATOR))
                    .containsExactlyInAnyOrder("e1", "e2");
            assertThat(fixture.cycle(pipeline.cycleId()).frozenRoster(pipeline.positionId()))
                    .containsExactly("n1", "n2", "n3");
        }

        @Test
        @DisplayName("should rank candidates from submitted scores")
        void ranksSubmittedScores() {
            fixture.scoreAll(pipeline);

            List<CandidateScore> rankings = fixture.evaluationService.rankings(pipeline.cycleId(), pipeline.positionId());

            assertThat(rankings).extracting(CandidateScore::getCandidateId).containsExactly("n2", "n1", "n3");
            assertThat(rankings.get(0).getTotal()).isCloseTo(86.0, within(1e-6));
            assertThat(fixture.evaluationService.outstandingScores(pipeline.cycleId())).isEmpty();
        }

        @Test
        @DisplayName("should overwrite an evaluator's earlier score for the same criterion")
        void resubmissionOverwrites() {
            fixture.submit(pipeline, "e1", "n1", pipeline.impactId(), 8);
            fixture.submit(pipeline, "e1", "n1", pipeline.impactId(), 4);

            assertThat(fixture.evaluationService.listScores(pipeline.positionId()))
                    .singleElement()
                    .extracting(EvaluationScore::getRawScore)
                    .isEqualTo(4.0);
        }

        @Test
        @DisplayName("should list missing criteria per evaluator and candidate")
        void outstandingScores() {
            fixture.submit(pipeline, "e1", "n1", pipeline.impactId(), 8);

            List<OutstandingScore> outstanding = fixture.evaluationService.outstandingScores(pipeline.cycleId());

            assertThat(outstanding).hasSize(6);
            assertThat(outstanding)
                    .filteredOn(entry -> entry.evaluatorId().equals("e1") && entry.candidateId().equals("n1"))
                    .singleElement()
                    .satisfies(entry -> assertThat(entry.missingCriterionIds()).containsExactly(pipeline.initiativeId()));
        }

        @Test
        @DisplayName("should keep a recusal when the evaluator is assigned again")
        void recusalSurvivesReassignment() {
            fixture.member("e3", 6.0);
            fixture.evaluationService.recuse(fixture.admin, pipeline.cycleId(), pipeline.positionId(), "e1", "n1",
                    "Worked for n1's company last year");

            fixture.evaluationService.assignEvaluators(fixture.admin, pipeline.cycleId(), pipeline.positionId(),
                    List.of("e1", "e3"), null);

            assertThat(fixture.evaluationRepository.findAssignment(pipeline.positionId(), "e1", "n1"))
                    .hasValueSatisfying(assignment -> {
                        assertThat(assignment.isRecused()).isTrue();
                        assertThat(assignment.getRecusalReason()).isEqualTo("Worked for n1's company last year");
                    });
            assertThat(fixture.evaluationRepository.findAssignment(pipeline.positionId(), "e1", "n2"))
                    .hasValueSatisfying(assignment -> assertThat(assignment.isRecused()).isFalse());
        }

        @Test
        @DisplayName("should reject scores outside the chapter scale")
        void rejectsOutOfScale() {
            assertThatThrownBy(() -> fixture.submit(pipeline, "e1", "n1", pipeline.impactId(), 11))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getFieldErrors()).containsKey("rawScore"));
        }

        @Test
        @DisplayName("should reject scores submitted under another identity or without an assignment")
        void rejectsForeignScores() {
            assertThatThrownBy(() -> fixture.evaluationService.submitScore(Actor.member("e2"), pipeline.cycleId(),
                    ScoreSubmission.builder()
                            .positionId(pipeline.positionId())
                            .evaluatorId("e1")
                            .candidateId("n1")
                            .criterionId(pipeline.impactId())
                            .rawScore(5)
                            .build()))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> fixture.submit(pipeline, "m1", "n1", pipeline.impactId(), 5))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        @DisplayName("should refuse scores once evaluations are closed")
        void closedToScores() {
            fixture.scoreAll(pipeline);
            fixture.transition(pipeline.cycleId(), CycleStatus.EVALUATIONS_CLOSED);

            assertThatThrownBy(() -> fixture.submit(pipeline, "e1", "n1", pipeline.impactId(), 2))
                    .isInstanceOf(ConflictException.class);
        }
    }
}
