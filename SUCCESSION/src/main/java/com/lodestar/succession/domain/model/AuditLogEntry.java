package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable record of one mutation.
 */
@Value
@Builder
@AllArgsConstructor
public class AuditLogEntry {

    String id;

    String cycleId;

    String actorId;

    /** e.g. {@code cycle.transition}, {@code score.submit} */
    String action;

    String entityType;

    String entityId;

    /** Short human-readable description */
    String summary;

    Object before;

    Object after;

    Instant timestamp;
}
