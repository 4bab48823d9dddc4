package com.lodestar.succession.domain.error;

import com.lodestar.succession.domain.model.CycleStatus;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input rejected; {@link #getFieldErrors()} maps field name to problem.
 */
@Getter
public class ValidationException extends SuccessionException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String field, String problem) {
        this(Map.of(field, problem), null);
    }

    public ValidationException(Map<String, String> fieldErrors, CycleStatus stage) {
        super("Validation failed: " + fieldErrors, stage, null);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Throws when the collected errors are non-empty.
     */
    public static void throwIfAny(Map<String, String> fieldErrors, CycleStatus stage) {
        if (!fieldErrors.isEmpty()) {
            throw new ValidationException(fieldErrors, stage);
        }
    }
}
