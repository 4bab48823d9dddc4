package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Vote;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryVoteRepository implements VoteRepository {

    private final Map<String, Vote> store = new ConcurrentHashMap<>();

    @Override
    public Vote upsert(Vote vote) {
        return store.compute(vote.getPositionId() + '|' + vote.getNomineeId() + '|' + vote.getVoterId(),
                (key, existing) -> vote);
    }

    @Override
    public List<Vote> findByPosition(String positionId) {
        return store.values().stream()
                .filter(vote -> positionId.equals(vote.getPositionId()))
                .sorted(Comparator.comparing(Vote::getNomineeId).thenComparing(Vote::getVoterId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Vote> findByCycle(String cycleId) {
        return store.values().stream()
                .filter(vote -> cycleId.equals(vote.getCycleId()))
                .sorted(Comparator.comparing(Vote::getPositionId)
                        .thenComparing(Vote::getNomineeId)
                        .thenComparing(Vote::getVoterId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean existsByMeeting(String meetingId) {
        return store.values().stream().anyMatch(vote -> meetingId.equals(vote.getMeetingId()));
    }
}
