package com.lodestar.succession.domain.error;

import com.lodestar.succession.domain.model.CycleStatus;
import lombok.Getter;

/**
 * Base of all domain failures. Carries the stage the cycle was in and, where a guard blocked
 * the operation, the guard's name.
 */
@Getter
public class SuccessionException extends RuntimeException {

    private final CycleStatus stage;
    private final String guard;

    public SuccessionException(String message) {
        this(message, null, null);
    }

    public SuccessionException(String message, CycleStatus stage, String guard) {
        super(message);
        this.stage = stage;
        this.guard = guard;
    }

    public SuccessionException(String message, CycleStatus stage, String guard, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.guard = guard;
    }
}
