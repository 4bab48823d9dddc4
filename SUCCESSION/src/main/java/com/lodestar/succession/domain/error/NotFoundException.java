package com.lodestar.succession.domain.error;

public class NotFoundException extends SuccessionException {

    public NotFoundException(String entityType, String id) {
        super(entityType + " not found: " + id);
    }
}
