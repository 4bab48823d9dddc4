package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Nomination;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository abstraction for candidacies. At most one candidacy exists per (position, nominee).
 */
public interface NominationRepository {

    Nomination save(Nomination nomination);

    Optional<Nomination> findById(String id);

    Optional<Nomination> findByPositionAndNominee(String positionId, String nomineeId);

    /**
     * Atomically create or update the candidacy for (position, nominee). The remapping function
     * receives the current candidacy, or {@code null}, and returns the one to store.
     */
    Nomination upsert(String positionId, String nomineeId, UnaryOperator<Nomination> remapping);

    List<Nomination> findByCycleId(String cycleId);

    List<Nomination> findByPositionId(String positionId);
}
