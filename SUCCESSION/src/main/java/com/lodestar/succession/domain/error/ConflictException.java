package com.lodestar.succession.domain.error;

import com.lodestar.succession.domain.model.CycleStatus;

/**
 * Request is well-formed but clashes with current state: wrong stage, duplicate record,
 * stale version or writing under another identity.
 */
public class ConflictException extends SuccessionException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, CycleStatus stage) {
        super(message, stage, null);
    }

    public ConflictException(String message, CycleStatus stage, String guard) {
        super(message, stage, guard);
    }
}
