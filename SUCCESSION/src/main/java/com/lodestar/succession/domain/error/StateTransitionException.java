package com.lodestar.succession.domain.error;

import com.lodestar.succession.domain.model.CycleStatus;
import lombok.Getter;

/**
 * A cycle could not move from {@link #getFrom()} to {@link #getTo()}.
 */
@Getter
public class StateTransitionException extends SuccessionException {

    private final CycleStatus from;
    private final CycleStatus to;

    public StateTransitionException(CycleStatus from, CycleStatus to, String guard, String detail) {
        super("Transition " + from + " -> " + to + " blocked"
                + (guard != null ? " by guard '" + guard + "'" : "") + ": " + detail, from, guard);
        this.from = from;
        this.to = to;
    }

    public StateTransitionException(CycleStatus from, CycleStatus to, String guard, String detail, Throwable cause) {
        super("Transition " + from + " -> " + to + " failed"
                + (guard != null ? " in '" + guard + "'" : "") + ": " + detail, from, guard, cause);
        this.from = from;
        this.to = to;
    }
}
