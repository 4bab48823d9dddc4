package com.lodestar.succession.audit;

import com.lodestar.succession.domain.model.AuditLogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Criteria for querying the audit trail. Unset fields match everything; the time range is
 * inclusive of {@code from} and exclusive of {@code to}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditFilter {

    private String cycleId;
    private String actorId;
    private String action;
    private String entityType;
    private Instant from;
    private Instant to;

    public static AuditFilter forCycle(String cycleId) {
        return AuditFilter.builder().cycleId(cycleId).build();
    }

    public boolean matches(AuditLogEntry entry) {
        return (cycleId == null || cycleId.equals(entry.getCycleId()))
                && (actorId == null || actorId.equals(entry.getActorId()))
                && (action == null || action.equals(entry.getAction()))
                && (entityType == null || entityType.equals(entry.getEntityType()))
                && (from == null || !entry.getTimestamp().isBefore(from))
                && (to == null || entry.getTimestamp().isBefore(to));
    }
}
