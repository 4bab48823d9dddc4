package com.lodestar.succession.domain.error;

/**
 * Member data needed for eligibility could not be obtained.
 */
public class EligibilityComputationException extends SuccessionException {

    public EligibilityComputationException(String message, Throwable cause) {
        super(message, null, null, cause);
    }
}
