package com.lodestar.succession.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.succession.domain.model.AuditLogEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AuditExporter}.
 */
class AuditExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final AuditExporter exporter = new AuditExporter(objectMapper);

    private static AuditLogEntry entry(String id, String summary) {
        return AuditLogEntry.builder()
                .id(id)
                .cycleId("cycle-1")
                .actorId("admin-1")
                .action("cycle.transition")
                .entityType("Cycle")
                .entityId("cycle-1")
                .summary(summary)
                .before(Map.of("status", "DRAFT"))
                .after(Map.of("status", "ACTIVE"))
                .timestamp(Instant.parse("2026-03-02T09:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("CSV")
    class CsvTests {

        @Test
        @DisplayName("should write a header row and one line per entry")
        void headerAndRows() {
            String csv = exporter.export(List.of(entry("a1", "DRAFT -> ACTIVE")), AuditExportFormat.CSV);

            assertThat(csv.split("\n")).containsExactly(
                    "id,cycleId,actorId,action,entityType,entityId,summary,timestamp",
                    "a1,cycle-1,admin-1,cycle.transition,Cycle,cycle-1,DRAFT -> ACTIVE,2026-03-02T09:00:00Z");
        }

        @Test
        @DisplayName("should quote values with commas, quotes or line breaks")
        void escaping() {
            assertThat(AuditExporter.escapeCsv("plain")).isEqualTo("plain");
            assertThat(AuditExporter.escapeCsv("a,b")).isEqualTo("\"a,b\"");
            assertThat(AuditExporter.escapeCsv("say \"yes\"")).isEqualTo("\"say \"\"yes\"\"\"");
            assertThat(AuditExporter.escapeCsv("line\nbreak")).isEqualTo("\"line\nbreak\"");
            assertThat(AuditExporter.escapeCsv("cr\rhere")).isEqualTo("\"cr\rhere\"");
        }

        @Test
        @DisplayName("should render missing values as empty cells")
        void emptyCells() {
            AuditLogEntry sparse = AuditLogEntry.builder().id("a2").action("cycle.create").build();

            String csv = exporter.toCsv(List.of(sparse));

            assertThat(csv.split("\n")[1]).isEqualTo("a2,,,cycle.create,,,,");
        }

        @Test
        @DisplayName("should export only the header for no entries")
        void noEntries() {
            assertThat(exporter.toCsv(List.of()))
                    .isEqualTo("id,cycleId,actorId,action,entityType,entityId,summary,timestamp\n");
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        @Test
        @DisplayName("should include before and after snapshots")
        void snapshots() throws Exception {
            String json = exporter.export(List.of(entry("a1", "Forced, with \"quotes\"")), AuditExportFormat.JSON);

            List<Map<String, Object>> rows = objectMapper.readValue(json, new TypeReference<>() {});
            assertThat(rows).singleElement().satisfies(row -> {
                assertThat(row).containsEntry("summary", "Forced, with \"quotes\"")
                        .containsEntry("timestamp", "2026-03-02T09:00:00Z")
                        .containsEntry("before", Map.of("status", "DRAFT"))
                        .containsEntry("after", Map.of("status", "ACTIVE"));
            });
        }
    }
}
