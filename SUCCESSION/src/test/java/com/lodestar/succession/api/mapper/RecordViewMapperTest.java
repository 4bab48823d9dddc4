package com.lodestar.succession.api.mapper;

import com.lodestar.succession.SuccessionTestFixture;
import com.lodestar.succession.SuccessionTestFixture.Pipeline;
import com.lodestar.succession.api.dto.CandidateScoreDto;
import com.lodestar.succession.api.dto.NominationDto;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.domain.model.SuccessionCycle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Field filtering of {@link RecordViewMapper} against a cycle in evaluations.
 */
class RecordViewMapperTest {

    private SuccessionTestFixture fixture;
    private Pipeline pipeline;
    private SuccessionCycle cycle;
    private Nomination n1;

    @BeforeEach
    void setUp() {
        fixture = new SuccessionTestFixture();
        pipeline = fixture.startEvaluations();
        fixture.scoreAll(pipeline);
        cycle = fixture.cycle(pipeline.cycleId());
        n1 = fixture.nominationRepository.findByPositionAndNominee(pipeline.positionId(), "n1").orElseThrow();
    }

    private Optional<NominationDto> view(String viewerId) {
        return fixture.viewMapper.nomination(Actor.member(viewerId), cycle, n1);
    }

    @Test
    @DisplayName("should hide the nominator from the nominee but not from the nominator")
    void nominatorAnonymity() {
        NominationDto asNominee = view("n1").orElseThrow();
        NominationDto asNominator = view("m1").orElseThrow();

        assertThat(asNominee.getJustification()).isNotBlank();
        assertThat(asNominee.getNominatorIds()).isNull();
        assertThat(asNominator.getNominatorIds()).containsExactly("m1");
    }

    @Test
    @DisplayName("should show evaluators the candidacy without nominators or consent")
    void evaluatorView() {
        NominationDto asEvaluator = view("e1").orElseThrow();

        assertThat(asEvaluator.getNomineeId()).isEqualTo("n1");
        assertThat(asEvaluator.getNominatorIds()).isNull();
        assertThat(asEvaluator.getConsentStatus()).isNull();
    }

    @Test
    @DisplayName("should leave the record out entirely for unrelated members")
    void unrelatedMember() {
        assertThat(view("x9")).isEmpty();
    }

    @Test
    @DisplayName("should show an evaluator only their own raw scores while scoring")
    void ownScoresOnly() {
        List<CandidateScoreDto> rows = fixture.viewMapper.rankings(Actor.member("e1"), cycle, pipeline.positionId(),
                fixture.evaluationService.rankings(pipeline.cycleId(), pipeline.positionId()),
                fixture.evaluationService.listScores(pipeline.positionId()));

        assertThat(rows).hasSize(3).allSatisfy(row -> {
            assertThat(row.getTotal()).isNull();
            assertThat(row.getEvaluatorScores()).hasSize(2)
                    .allSatisfy(score -> assertThat(score.getEvaluatorId()).isEqualTo("e1"));
        });
    }

    @Test
    @DisplayName("should show admins the full ranking")
    void adminRanking() {
        List<CandidateScoreDto> rows = fixture.viewMapper.rankings(fixture.admin, cycle, pipeline.positionId(),
                fixture.evaluationService.rankings(pipeline.cycleId(), pipeline.positionId()),
                fixture.evaluationService.listScores(pipeline.positionId()));

        assertThat(rows).extracting(CandidateScoreDto::getCandidateId).containsExactly("n2", "n1", "n3");
        assertThat(rows).extracting(CandidateScoreDto::getTotal).containsExactly(86.0, 70.0, 50.0);
    }
}
