package com.lodestar.succession.observability;

import com.lodestar.succession.domain.model.CycleStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the SUCCESSION service.
 * <p>
 * Emits {@code message | data={...}} lines under an MDC scope carrying the cycle, position and
 * actor, so stage changes and automation runs can be followed per cycle.
 */
@Slf4j
@Component
public class SuccessionStructuredLogger {

    // MDC keys
    public static final String MDC_CYCLE_ID = "cycleId";
    public static final String MDC_POSITION_ID = "positionId";
    public static final String MDC_ACTOR_ID = "actorId";

    /**
     * Log a cycle lifecycle event.
     */
    public void logTransitionEvent(String cycleId, String actorId, TransitionEventType eventType,
                                   CycleStatus from, CycleStatus to, String message,
                                   Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_CYCLE_ID, cycleId,
                MDC_ACTOR_ID, actorId != null ? actorId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("cycleId", cycleId);
            logData.put("from", from != null ? from.name() : null);
            logData.put("to", to != null ? to.name() : null);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case COMPLETED -> log.info("{} | data={}", message, formatLogData(logData));
                case OVERRIDDEN, REVERTED -> log.warn("{} | data={}", message, formatLogData(logData));
                case BLOCKED -> log.info("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a deadline automation event.
     */
    public void logAutomationEvent(String cycleId, AutomationEventType eventType, String message,
                                   Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_CYCLE_ID, cycleId, MDC_ACTOR_ID, "system"))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("cycleId", cycleId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case ADVANCED, WARNING_SENT -> log.info("{} | data={}", message, formatLogData(logData));
                case ATTEMPT_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
                case ESCALATED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a candidacy intake event.
     */
    public void logCandidacyEvent(String cycleId, String positionId, String actorId,
                                  CandidacyEventType eventType, String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_CYCLE_ID, cycleId,
                MDC_POSITION_ID, positionId != null ? positionId : "",
                MDC_ACTOR_ID, actorId != null ? actorId : ""))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("positionId", positionId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case DISQUALIFIED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum TransitionEventType {
        COMPLETED, BLOCKED, FAILED, OVERRIDDEN, REVERTED
    }

    public enum AutomationEventType {
        SKIPPED, ADVANCED, ATTEMPT_FAILED, ESCALATED, WARNING_SENT
    }

    public enum CandidacyEventType {
        SUBMITTED, MERGED, WITHDRAWN, CONSENTED, DECLINED, DISQUALIFIED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
