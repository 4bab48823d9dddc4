package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Vote;

import java.util.List;

/**
 * Repository abstraction for committee ballots, unique per (position, nominee, voter).
 */
public interface VoteRepository {

    /**
     * Insert or overwrite the ballot of the vote's voter for its nominee.
     */
    Vote upsert(Vote vote);

    List<Vote> findByPosition(String positionId);

    List<Vote> findByCycle(String cycleId);

    boolean existsByMeeting(String meetingId);
}
