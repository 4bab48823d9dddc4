package com.lodestar.succession.audit;

import com.lodestar.succession.domain.model.AuditLogEntry;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Repository
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<AuditLogEntry> query(AuditFilter filter) {
        return entries.stream()
                .filter(filter::matches)
                .collect(Collectors.toList());
    }
}
