package com.lodestar.succession.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.AuditLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point through which every mutation is recorded. Before and after states are
 * snapshotted at call time, so later changes to the entities do not leak into the trail.
 */
@Slf4j
@Service
public class AuditService {

    private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final AuditSink sink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(AuditSink sink, ObjectMapper objectMapper, Clock clock) {
        this.sink = sink;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public AuditLogEntry record(String cycleId, Actor actor, String action, String entityType,
                                String entityId, String summary, Object before, Object after) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .cycleId(cycleId)
                .actorId(actor.id())
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .summary(summary)
                .before(snapshot(before))
                .after(snapshot(after))
                .timestamp(clock.instant())
                .build();
        sink.append(entry);
        log.debug("Audit {} on {} {} by {}", action, entityType, entityId, actor.id());
        return entry;
    }

    public List<AuditLogEntry> query(AuditFilter filter) {
        return sink.query(filter);
    }

    private Object snapshot(Object state) {
        if (state == null || state instanceof String || state instanceof Number || state instanceof Boolean) {
            return state;
        }
        if (state instanceof Enum<?> value) {
            return value.name();
        }
        return objectMapper.convertValue(state, SNAPSHOT_TYPE);
    }
}
