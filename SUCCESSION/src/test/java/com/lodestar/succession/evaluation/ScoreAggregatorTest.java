package com.lodestar.succession.evaluation;

import com.lodestar.succession.domain.model.EvaluationCriterion;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.EvaluatorAssignment;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.policy.ChapterPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ScoreAggregator}.
 */
class ScoreAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private final ScoreAggregator aggregator = new ScoreAggregator();
    private final ChapterPolicy policy = ChapterPolicy.defaults();

    private final List<EvaluationCriterion> rubric = List.of(
            criterion("impact", 0.6),
            criterion("initiative", 0.4));

    private final List<EvaluationScore> scores = new ArrayList<>();

    @Test
    @DisplayName("should rank candidates by weighted mean of evaluator scores")
    void ranksByWeightedMean() {
        List<Nomination> candidates = List.of(nomination("n1", 0), nomination("n2", 1), nomination("n3", 2));
        List<EvaluatorAssignment> assignments = assign(List.of("e1", "e2"), List.of("n1", "n2", "n3"));
        score("e1", "n1", 8, 6);
        score("e2", "n1", 6, 8);
        score("e1", "n2", 9, 9);
        score("e2", "n2", 9, 7);
        score("e1", "n3", 5, 5);
        score("e2", "n3", 5, 5);

        List<CandidateScore> ranked = aggregator.rank(rubric, candidates, assignments, scores, policy);

        assertThat(ranked).extracting(CandidateScore::getCandidateId).containsExactly("n2", "n1", "n3");
        assertThat(ranked).extracting(CandidateScore::getRank).containsExactly(1, 2, 3);
        // (0.6 * 9 + 0.4 * 8) / 10 * 100
        assertThat(ranked.get(0).getTotal()).isCloseTo(86.0, within(1e-6));
        assertThat(ranked.get(1).getTotal()).isCloseTo(70.0, within(1e-6));
        assertThat(ranked.get(2).getTotal()).isCloseTo(50.0, within(1e-6));
        assertThat(ranked.get(0).getCriterionMeans()).containsEntry("impact", 9.0).containsEntry("initiative", 8.0);
        assertThat(ranked.get(0).getEvaluatorCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should break equal totals by unanimity, then by earlier nomination")
    void tieBreaks() {
        List<Nomination> candidates = List.of(nomination("late", 5), nomination("split", 1), nomination("early", 0));
        List<EvaluatorAssignment> assignments = assign(List.of("e1", "e2"), List.of("late", "split", "early"));
        // all three average 7 on both criteria
        score("e1", "split", 6, 8);
        score("e2", "split", 8, 6);
        score("e1", "late", 7, 7);
        score("e2", "late", 7, 7);
        score("e1", "early", 7, 6);
        score("e2", "early", 7, 8);

        List<CandidateScore> ranked = aggregator.rank(rubric, candidates, assignments, scores, policy);

        assertThat(ranked).extracting(CandidateScore::getTotal).containsOnly(70.0);
        assertThat(ranked).extracting(CandidateScore::getUnanimityCount).containsExactly(2, 1, 0);
        assertThat(ranked).extracting(CandidateScore::getCandidateId).containsExactly("late", "early", "split");
    }

    @Test
    @DisplayName("should ignore scores from recused or unassigned evaluators")
    void ignoresRecusedScores() {
        List<Nomination> candidates = List.of(nomination("n1", 0));
        List<EvaluatorAssignment> assignments = new ArrayList<>(assign(List.of("e1"), List.of("n1")));
        assignments.add(EvaluatorAssignment.builder()
                .positionId("pos-1").evaluatorId("e2").candidateId("n1").recused(true).recusalReason("sibling")
                .build());
        score("e1", "n1", 6, 6);
        score("e2", "n1", 10, 10);
        score("stranger", "n1", 0, 0);

        CandidateScore result = aggregator.rank(rubric, candidates, assignments, scores, policy).get(0);

        assertThat(result.getTotal()).isCloseTo(60.0, within(1e-6));
        assertThat(result.getEvaluatorCount()).isEqualTo(1);
        assertThat(result.getUnanimityCount()).isZero();
    }

    @Test
    @DisplayName("should score candidates without any scores as zero")
    void unscoredCandidate() {
        List<CandidateScore> ranked = aggregator.rank(rubric, List.of(nomination("n1", 0)),
                assign(List.of("e1"), List.of("n1")), scores, policy);

        assertThat(ranked).singleElement().satisfies(result -> {
            assertThat(result.getTotal()).isZero();
            assertThat(result.getCriterionMeans()).isEmpty();
        });
    }

    private void score(String evaluatorId, String candidateId, double impact, double initiative) {
        scores.add(EvaluationScore.builder().evaluatorId(evaluatorId).candidateId(candidateId)
                .criterionId("impact").positionId("pos-1").rawScore(impact).build());
        scores.add(EvaluationScore.builder().evaluatorId(evaluatorId).candidateId(candidateId)
                .criterionId("initiative").positionId("pos-1").rawScore(initiative).build());
    }

    private static List<EvaluatorAssignment> assign(List<String> evaluators, List<String> candidates) {
        List<EvaluatorAssignment> assignments = new ArrayList<>();
        for (String evaluator : evaluators) {
            for (String candidate : candidates) {
                assignments.add(EvaluatorAssignment.builder()
                        .positionId("pos-1")
                        .evaluatorId(evaluator)
                        .candidateId(candidate)
                        .build());
            }
        }
        return assignments;
    }

    private static EvaluationCriterion criterion(String id, double weight) {
        return EvaluationCriterion.builder().id(id).positionId("pos-1").name(id).weight(weight).build();
    }

    private static Nomination nomination(String nomineeId, int minutesAfterStart) {
        return Nomination.builder()
                .id("nom-" + nomineeId)
                .positionId("pos-1")
                .nomineeId(nomineeId)
                .submittedAt(T0.plusSeconds(60L * minutesAfterStart))
                .build();
    }
}
