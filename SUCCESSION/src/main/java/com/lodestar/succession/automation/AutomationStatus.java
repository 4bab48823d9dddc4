package com.lodestar.succession.automation;

import com.lodestar.succession.domain.model.CycleStatus;

import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of the scheduler's view of one cycle.
 *
 * @param consecutiveFailures failed automatic transitions since the last success
 * @param escalated           whether admins have been alerted
 * @param warnedStages        stages whose deadline warning already went out
 */
public record AutomationStatus(
        String cycleId,
        int consecutiveFailures,
        boolean escalated,
        String lastError,
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        Set<CycleStatus> warnedStages
) {
}
