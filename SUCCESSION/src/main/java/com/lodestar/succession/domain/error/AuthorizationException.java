package com.lodestar.succession.domain.error;

import com.lodestar.succession.domain.model.CycleStatus;

public class AuthorizationException extends SuccessionException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, CycleStatus stage) {
        super(message, stage, null);
    }
}
