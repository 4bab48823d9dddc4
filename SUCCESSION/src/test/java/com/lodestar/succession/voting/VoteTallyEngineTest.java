package com.lodestar.succession.voting;

import com.lodestar.succession.domain.model.Vote;
import com.lodestar.succession.domain.model.Vote.VoteValue;
import com.lodestar.succession.policy.ChapterPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VoteTallyEngine}.
 */
class VoteTallyEngineTest {

    private static final Set<String> COMMITTEE = Set.of("c1", "c2", "c3");

    private final VoteTallyEngine engine = new VoteTallyEngine();
    private final ChapterPolicy policy = ChapterPolicy.defaults();

    private static Vote vote(String voter, String nominee, VoteValue value) {
        return Vote.builder().positionId("pos-1").voterId(voter).nomineeId(nominee).value(value).build();
    }

    private SelectionResolution resolve(List<Vote> votes, Set<String> committee, Map<String, Double> scores) {
        return engine.resolve("pos-1", List.of("n1", "n2", "n3"), votes, committee, scores, policy);
    }

    @Test
    @DisplayName("should qualify a candidate with a majority of the seated committee")
    void majorityQualifies() {
        SelectionResolution resolution = resolve(List.of(
                vote("c1", "n1", VoteValue.YES),
                vote("c2", "n1", VoteValue.YES),
                vote("c3", "n1", VoteValue.NO)), COMMITTEE, Map.of());

        assertThat(resolution.getRequiredYesVotes()).isEqualTo(2);
        assertThat(resolution.getSoleQualifier()).isEqualTo("n1");
        assertThat(resolution.isRequiresAdminDecision()).isFalse();
        assertThat(resolution.getTallies().get(0))
                .extracting(CandidateTally::getYes, CandidateTally::getNo)
                .containsExactly(2, 1);
    }

    @Test
    @DisplayName("should not qualify a single yes when abstentions leave quorum unmet")
    void belowQuorum() {
        SelectionResolution resolution = resolve(List.of(
                vote("c1", "n1", VoteValue.YES),
                vote("c2", "n1", VoteValue.ABSTAIN),
                vote("c3", "n1", VoteValue.ABSTAIN)), COMMITTEE, Map.of());

        assertThat(resolution.getQualifying()).isEmpty();
        assertThat(resolution.isRequiresAdminDecision()).isTrue();
    }

    @Test
    @DisplayName("should require yes votes to outnumber no votes")
    void yesMustBeatNo() {
        Set<String> committee = Set.of("c1", "c2", "c3", "c4");
        SelectionResolution resolution = resolve(List.of(
                vote("c1", "n1", VoteValue.YES),
                vote("c2", "n1", VoteValue.YES),
                vote("c3", "n1", VoteValue.NO),
                vote("c4", "n1", VoteValue.NO)), committee, Map.of());

        assertThat(resolution.getRequiredYesVotes()).isEqualTo(2);
        assertThat(resolution.getQualifying()).isEmpty();
    }

    @Test
    @DisplayName("should ignore ballots from voters no longer seated")
    void unseatedIgnored() {
        SelectionResolution resolution = resolve(List.of(
                vote("c1", "n1", VoteValue.YES),
                vote("former", "n1", VoteValue.YES)), COMMITTEE, Map.of());

        assertThat(resolution.getTallies())
                .filteredOn(tally -> tally.getCandidateId().equals("n1"))
                .singleElement()
                .extracting(CandidateTally::getYes)
                .isEqualTo(1);
        assertThat(resolution.getQualifying()).isEmpty();
    }

    @Test
    @DisplayName("should leave several qualifiers to the admin, ordered by yes count then evaluation score")
    void severalQualifiers() {
        Set<String> committee = Set.of("c1", "c2", "c3", "c4", "c5");
        SelectionResolution resolution = resolve(List.of(
                vote("c1", "n1", VoteValue.YES),
                vote("c2", "n1", VoteValue.YES),
                vote("c3", "n1", VoteValue.YES),
                vote("c1", "n2", VoteValue.YES),
                vote("c2", "n2", VoteValue.YES),
                vote("c3", "n2", VoteValue.YES),
                vote("c4", "n3", VoteValue.YES),
                vote("c5", "n3", VoteValue.YES),
                vote("c1", "n3", VoteValue.YES),
                vote("c2", "n3", VoteValue.YES)), committee, Map.of("n1", 70.0, "n2", 86.0, "n3", 50.0));

        assertThat(resolution.getRequiredYesVotes()).isEqualTo(3);
        assertThat(resolution.getQualifying()).containsExactly("n3", "n2", "n1");
        assertThat(resolution.getSoleQualifier()).isNull();
        assertThat(resolution.isRequiresAdminDecision()).isTrue();
    }

    @Test
    @DisplayName("should qualify nobody without a seated committee")
    void emptyCommittee() {
        SelectionResolution resolution = resolve(List.of(vote("c1", "n1", VoteValue.YES)), Set.of(), Map.of());

        assertThat(resolution.getRequiredYesVotes()).isZero();
        assertThat(resolution.getQualifying()).isEmpty();
        assertThat(resolution.getTallies()).hasSize(3).allMatch(tally -> tally.getYes() == 0);
    }
}
