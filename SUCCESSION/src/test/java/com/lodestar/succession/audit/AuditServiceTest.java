package com.lodestar.succession.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.succession.MutableClock;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.AuditLogEntry;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AuditService}.
 */
class AuditServiceTest {

    private static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(new InMemoryAuditSink(), new ObjectMapper().findAndRegisterModules(), clock);
        auditService.record("c1", Actor.admin("admin-1"), "cycle.create", "Cycle", "c1", "created", null, null);
        clock.advance(Duration.ofHours(1));
        auditService.record("c1", Actor.member("m1"), "nomination.create", "Nomination", "nom-1", "nominated", null,
                Map.of("nomineeId", "n1"));
        clock.advance(Duration.ofHours(1));
        auditService.record("c2", Actor.admin("admin-1"), "cycle.create", "Cycle", "c2", "created", null, null);
    }

    @Test
    @DisplayName("should stamp entries with the clock and snapshot objects as maps")
    void snapshots() {
        Position position = Position.builder().id("p1").title("Treasurer").build();
        AuditLogEntry entry = auditService.record("c1", Actor.admin("admin-1"), "position.add", "Position", "p1",
                "added", CycleStatus.DRAFT, position);

        assertThat(entry.getTimestamp()).isEqualTo(clock.instant());
        assertThat(entry.getBefore()).isEqualTo("DRAFT");
        assertThat(entry.getAfter()).isInstanceOf(Map.class);
        assertThat((Map<String, Object>) entry.getAfter()).containsEntry("title", "Treasurer");
    }

    @Test
    @DisplayName("should filter by cycle, action and actor")
    void filters() {
        assertThat(auditService.query(AuditFilter.forCycle("c1"))).hasSize(2);
        assertThat(auditService.query(AuditFilter.builder().action("cycle.create").build())).hasSize(2);
        assertThat(auditService.query(AuditFilter.builder().actorId("m1").build()))
                .extracting(AuditLogEntry::getEntityId)
                .containsExactly("nom-1");
    }

    @Test
    @DisplayName("should treat the time window as from inclusive, to exclusive")
    void timeWindow() {
        List<AuditLogEntry> window = auditService.query(AuditFilter.builder()
                .from(START.plus(Duration.ofHours(1)))
                .to(START.plus(Duration.ofHours(2)))
                .build());

        assertThat(window).extracting(AuditLogEntry::getAction).containsExactly("nomination.create");
    }
}
