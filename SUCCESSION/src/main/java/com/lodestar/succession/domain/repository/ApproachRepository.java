package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.CandidateApproach;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository abstraction for candidate approaches, unique per (position, nominee).
 */
public interface ApproachRepository {

    /**
     * Store the approach unless one already exists for its (position, nominee).
     *
     * @return false when the key was taken
     */
    boolean insert(CandidateApproach approach);

    /**
     * Atomically replace the approach with the result of {@code update}.
     */
    CandidateApproach update(String approachId, UnaryOperator<CandidateApproach> update);

    Optional<CandidateApproach> findById(String approachId);

    Optional<CandidateApproach> findByPositionAndNominee(String positionId, String nomineeId);

    List<CandidateApproach> findByCycle(String cycleId);

    void delete(String approachId);
}
