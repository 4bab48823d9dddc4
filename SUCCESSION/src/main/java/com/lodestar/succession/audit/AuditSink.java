package com.lodestar.succession.audit;

import com.lodestar.succession.domain.model.AuditLogEntry;

import java.util.List;

/**
 * Append-only store for audit entries.
 */
public interface AuditSink {

    void append(AuditLogEntry entry);

    /**
     * Entries matching the filter, oldest first.
     */
    List<AuditLogEntry> query(AuditFilter filter);
}
