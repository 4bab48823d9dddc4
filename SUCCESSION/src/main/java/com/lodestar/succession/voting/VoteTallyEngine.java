package com.lodestar.succession.voting;

import com.lodestar.succession.domain.model.Vote;
import com.lodestar.succession.policy.ChapterPolicy;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Counts ballots and applies the quorum rule:
 * {@code yes >= ceil(quorumFraction * seatedCommitteeSize)} and {@code yes > no}.
 */
@Component
public class VoteTallyEngine {

    private static final Comparator<CandidateTally> ORDER = Comparator
            .comparing(CandidateTally::isQualifies).reversed()
            .thenComparing(Comparator.comparingInt(CandidateTally::getYes).reversed())
            .thenComparing(CandidateTally::getEvaluationScore, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(CandidateTally::getCandidateId);

    /**
     * @param candidateIds     candidates on the ballot
     * @param votes            ballots for the position; ballots of unseated voters are ignored
     * @param seatedCommittee  current committee members
     * @param evaluationScores evaluation totals by candidate, used to order equal yes counts
     */
    public SelectionResolution resolve(String positionId, Collection<String> candidateIds, List<Vote> votes,
                                       Set<String> seatedCommittee, Map<String, Double> evaluationScores,
                                       ChapterPolicy policy) {
        int required = policy.requiredYesVotes(seatedCommittee.size());
        Map<String, List<Vote>> byCandidate = votes.stream()
                .filter(vote -> seatedCommittee.contains(vote.getVoterId()))
                .collect(Collectors.groupingBy(Vote::getNomineeId));

        List<CandidateTally> tallies = new ArrayList<>();
        for (String candidateId : new LinkedHashSet<>(candidateIds)) {
            List<Vote> ballots = byCandidate.getOrDefault(candidateId, List.of());
            int yes = count(ballots, Vote.VoteValue.YES);
            int no = count(ballots, Vote.VoteValue.NO);
            tallies.add(CandidateTally.builder()
                    .candidateId(candidateId)
                    .yes(yes)
                    .no(no)
                    .abstain(count(ballots, Vote.VoteValue.ABSTAIN))
                    .evaluationScore(evaluationScores.get(candidateId))
                    .qualifies(!seatedCommittee.isEmpty() && yes >= required && yes > no)
                    .build());
        }
        tallies.sort(ORDER);

        List<String> qualifying = tallies.stream()
                .filter(CandidateTally::isQualifies)
                .map(CandidateTally::getCandidateId)
                .collect(Collectors.toList());
        return SelectionResolution.builder()
                .positionId(positionId)
                .seatedCommitteeSize(seatedCommittee.size())
                .requiredYesVotes(required)
                .tallies(tallies)
                .qualifying(qualifying)
                .soleQualifier(qualifying.size() == 1 ? qualifying.get(0) : null)
                .requiresAdminDecision(qualifying.size() != 1)
                .build();
    }

    private static int count(List<Vote> ballots, Vote.VoteValue value) {
        return (int) ballots.stream().filter(vote -> vote.getValue() == value).count();
    }
}
