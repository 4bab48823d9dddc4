package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Selection;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for selections. Enforces at most one active selection per position.
 */
public interface SelectionRepository {

    /**
     * Store a new active selection unless the position already has one.
     *
     * @return {@code false} when another active selection exists
     */
    boolean insertActive(Selection selection);

    /**
     * Persist changes to an existing selection, e.g. a revocation.
     */
    Selection update(Selection selection);

    Optional<Selection> findById(String id);

    Optional<Selection> findActiveByPosition(String positionId);

    List<Selection> findByCycle(String cycleId);
}
