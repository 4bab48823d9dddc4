package com.lodestar.succession.domain.service;

import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.CycleRepository;
import com.lodestar.succession.domain.repository.PositionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

/**
 * Shared lookups and precondition checks used by the stage-gated services.
 */
@Component
@RequiredArgsConstructor
public class CycleLookup {

    private final CycleRepository cycleRepository;
    private final PositionRepository positionRepository;

    public SuccessionCycle requireCycle(String cycleId) {
        return cycleRepository.findById(cycleId)
                .orElseThrow(() -> new NotFoundException("Cycle", cycleId));
    }

    public Position requirePosition(String positionId) {
        return positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException("Position", positionId));
    }

    /**
     * Active position belonging to the given cycle.
     */
    public Position requireActivePosition(SuccessionCycle cycle, String positionId) {
        Position position = requirePosition(positionId);
        if (!cycle.getId().equals(position.getCycleId()) || !position.isActive()) {
            throw new NotFoundException("Position", positionId);
        }
        return position;
    }

    /**
     * Fails with a conflict naming the current stage unless it accepts the operation.
     */
    public void requireStage(SuccessionCycle cycle, Predicate<CycleStatus> accepts, String operation) {
        if (!accepts.test(cycle.getStatus())) {
            throw new ConflictException(operation + " is not accepted while the cycle is " + cycle.getStatus(),
                    cycle.getStatus());
        }
    }

    public static void requireAdmin(Actor actor, String operation) {
        if (!actor.isAdmin()) {
            throw new AuthorizationException("Only an admin may " + operation);
        }
    }
}
