package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.TimelineStep;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for cycle timeline steps, unique per (cycle, step number).
 */
public interface TimelineRepository {

    TimelineStep save(TimelineStep step);

    Optional<TimelineStep> findById(String stepId);

    /**
     * Steps of the cycle in step-number order.
     */
    List<TimelineStep> findByCycle(String cycleId);

    void delete(String stepId);
}
