package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.SuccessionCycle;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for cycle persistence. Cycles are archived, never deleted.
 */
public interface CycleRepository {

    /**
     * Persist the given cycle. Existing cycles are replaced.
     */
    SuccessionCycle save(SuccessionCycle cycle);

    /**
     * Look up a cycle by ID. The returned instance is a copy; changes require {@link #save}.
     */
    Optional<SuccessionCycle> findById(String id);

    List<SuccessionCycle> findAll();

    /**
     * Cycles that have not reached a terminal status.
     */
    List<SuccessionCycle> findOpen();
}
