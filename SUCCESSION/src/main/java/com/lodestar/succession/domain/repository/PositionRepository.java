package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for positions.
 */
public interface PositionRepository {

    Position save(Position position);

    Optional<Position> findById(String id);

    /**
     * Positions of a cycle ordered by hierarchy level, most senior first.
     */
    List<Position> findByCycleId(String cycleId);
}
