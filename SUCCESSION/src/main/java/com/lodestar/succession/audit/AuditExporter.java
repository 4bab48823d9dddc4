package com.lodestar.succession.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.succession.domain.error.SuccessionException;
import com.lodestar.succession.domain.model.AuditLogEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders audit entries as CSV or JSON.
 * <p>
 * CSV columns are fixed; any value containing a comma, double quote, carriage return or
 * newline is wrapped in double quotes with inner quotes doubled.
 */
@Component
public class AuditExporter {

    static final List<String> COLUMNS = List.of(
            "id", "cycleId", "actorId", "action", "entityType", "entityId", "summary", "timestamp");

    private final ObjectMapper objectMapper;

    public AuditExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String export(List<AuditLogEntry> entries, AuditExportFormat format) {
        return switch (format) {
            case CSV -> toCsv(entries);
            case JSON -> toJson(entries);
        };
    }

    public String toCsv(List<AuditLogEntry> entries) {
        StringBuilder csv = new StringBuilder(String.join(",", COLUMNS)).append('\n');
        for (AuditLogEntry entry : entries) {
            List<String> row = new ArrayList<>(COLUMNS.size());
            for (Object value : columns(entry).values()) {
                row.add(escapeCsv(value == null ? "" : value.toString()));
            }
            csv.append(String.join(",", row)).append('\n');
        }
        return csv.toString();
    }

    public String toJson(List<AuditLogEntry> entries) {
        List<Map<String, Object>> rows = new ArrayList<>(entries.size());
        for (AuditLogEntry entry : entries) {
            Map<String, Object> row = columns(entry);
            row.put("before", entry.getBefore());
            row.put("after", entry.getAfter());
            rows.add(row);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new SuccessionException("Failed to render audit export: " + e.getOriginalMessage());
        }
    }

    static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private Map<String, Object> columns(AuditLogEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", entry.getId());
        row.put("cycleId", entry.getCycleId());
        row.put("actorId", entry.getActorId());
        row.put("action", entry.getAction());
        row.put("entityType", entry.getEntityType());
        row.put("entityId", entry.getEntityId());
        row.put("summary", entry.getSummary());
        row.put("timestamp", entry.getTimestamp() != null ? entry.getTimestamp().toString() : null);
        return row;
    }
}
