package com.lodestar.succession.automation;

import com.lodestar.succession.domain.model.CycleStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-cycle automation bookkeeping: consecutive failures, escalation flag and the stages
 * already warned about. A success clears failures and escalation; a revert clears the warnings
 * of the stages it leaves and re-enters.
 */
@Component
public class AutomationStatusTracker {

    private final Map<String, AutomationStatus> statuses = new ConcurrentHashMap<>();

    public AutomationStatus status(String cycleId) {
        return statuses.getOrDefault(cycleId, initial(cycleId));
    }

    /**
     * @return the failure count after this failure
     */
    public int recordFailure(String cycleId, String error, Instant at) {
        return statuses.compute(cycleId, (id, current) -> {
            AutomationStatus base = current != null ? current : initial(id);
            return new AutomationStatus(id, base.consecutiveFailures() + 1, base.escalated(), error, at,
                    base.lastSuccessAt(), base.warnedStages());
        }).consecutiveFailures();
    }

    public void recordSuccess(String cycleId, Instant at) {
        statuses.compute(cycleId, (id, current) -> {
            AutomationStatus base = current != null ? current : initial(id);
            return new AutomationStatus(id, 0, false, null, at, at, base.warnedStages());
        });
    }

    /**
     * Flag the cycle as escalated.
     *
     * @return true only for the call that set the flag
     */
    public boolean markEscalated(String cycleId) {
        boolean[] changed = {false};
        statuses.compute(cycleId, (id, current) -> {
            AutomationStatus base = current != null ? current : initial(id);
            if (base.escalated()) {
                return base;
            }
            changed[0] = true;
            return new AutomationStatus(id, base.consecutiveFailures(), true, base.lastError(),
                    base.lastAttemptAt(), base.lastSuccessAt(), base.warnedStages());
        });
        return changed[0];
    }

    /**
     * Remember that the warning for {@code stage} went out.
     *
     * @return true only the first time for the stage
     */
    public boolean markWarned(String cycleId, CycleStatus stage) {
        boolean[] changed = {false};
        statuses.compute(cycleId, (id, current) -> {
            AutomationStatus base = current != null ? current : initial(id);
            if (base.warnedStages().contains(stage)) {
                return base;
            }
            Set<CycleStatus> warned = EnumSet.of(stage);
            warned.addAll(base.warnedStages());
            changed[0] = true;
            return new AutomationStatus(id, base.consecutiveFailures(), base.escalated(), base.lastError(),
                    base.lastAttemptAt(), base.lastSuccessAt(), Set.copyOf(warned));
        });
        return changed[0];
    }

    /**
     * Forget the warnings sent for {@code stages}, so re-entering one of them warns again.
     */
    public void clearWarnings(String cycleId, Set<CycleStatus> stages) {
        statuses.computeIfPresent(cycleId, (id, current) -> {
            Set<CycleStatus> warned = current.warnedStages().isEmpty()
                    ? EnumSet.noneOf(CycleStatus.class) : EnumSet.copyOf(current.warnedStages());
            if (!warned.removeAll(stages)) {
                return current;
            }
            return new AutomationStatus(id, current.consecutiveFailures(), current.escalated(), current.lastError(),
                    current.lastAttemptAt(), current.lastSuccessAt(), Set.copyOf(warned));
        });
    }

    public int escalatedCount() {
        return (int) statuses.values().stream().filter(AutomationStatus::escalated).count();
    }

    private static AutomationStatus initial(String cycleId) {
        return new AutomationStatus(cycleId, 0, false, null, null, null, Set.of());
    }
}
