package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.audit.AuditExportFormat;
import com.lodestar.succession.audit.AuditExporter;
import com.lodestar.succession.audit.AuditFilter;
import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.AuditLogEntry;
import com.lodestar.succession.domain.service.CycleLookup;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * REST API controller for the audit trail. Admin only.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Audit", description = "Audit trail queries and export")
public class AuditController {

    private final AuditService auditService;
    private final AuditExporter auditExporter;
    private final CycleLookup cycleLookup;

    public AuditController(AuditService auditService, AuditExporter auditExporter, CycleLookup cycleLookup) {
        this.auditService = auditService;
        this.auditExporter = auditExporter;
        this.cycleLookup = cycleLookup;
    }

    @GetMapping("/cycles/{cycleId}/audit")
    @Operation(summary = "Query cycle audit trail")
    public Mono<ResponseEntity<List<AuditLogEntry>>> cycleAudit(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String auditActorId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            CycleLookup.requireAdmin(actor, "read the audit trail");
            cycleLookup.requireCycle(cycleId);
            return ResponseEntity.ok(auditService.query(AuditFilter.builder()
                    .cycleId(cycleId)
                    .action(action)
                    .entityType(entityType)
                    .actorId(auditActorId)
                    .from(from)
                    .to(to)
                    .build()));
        });
    }

    @GetMapping("/audit/export")
    @Operation(summary = "Export audit trail", description = "Filtered audit entries as CSV or JSON, oldest first")
    public Mono<ResponseEntity<String>> export(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @Parameter(description = "csv or json") @RequestParam(defaultValue = "csv") String format,
            @RequestParam(required = false) String cycleId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String auditActorId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            CycleLookup.requireAdmin(actor, "export the audit trail");
            AuditExportFormat exportFormat = parseFormat(format);
            List<AuditLogEntry> entries = auditService.query(AuditFilter.builder()
                    .cycleId(cycleId)
                    .action(action)
                    .entityType(entityType)
                    .actorId(auditActorId)
                    .from(from)
                    .to(to)
                    .build());
            log.info("Audit export: format={}, entries={}, actor={}", exportFormat, entries.size(), actor.id());
            String filename = "audit" + (cycleId != null ? "-" + cycleId : "") + "."
                    + exportFormat.name().toLowerCase(Locale.ROOT);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(exportFormat.contentType()))
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                    .body(auditExporter.export(entries, exportFormat));
        });
    }

    private static AuditExportFormat parseFormat(String format) {
        try {
            return AuditExportFormat.valueOf(format.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("format", "unsupported export format " + format);
        }
    }
}
