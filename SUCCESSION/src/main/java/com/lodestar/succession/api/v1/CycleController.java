package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.api.dto.CycleDto;
import com.lodestar.succession.api.dto.CycleListResponse;
import com.lodestar.succession.api.mapper.CycleMapper;
import com.lodestar.succession.automation.AutomationScheduler;
import com.lodestar.succession.automation.AutomationStatus;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.MemberActivity;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.service.CycleAdminService;
import com.lodestar.succession.domain.service.CycleDraft;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.domain.service.PositionDraft;
import com.lodestar.succession.eligibility.EligibilityService;
import com.lodestar.succession.eligibility.RecomputeReport;
import com.lodestar.succession.lifecycle.CycleStateMachine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * REST API controller for cycle administration and lifecycle control.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Cycles", description = "Cycle setup, positions and lifecycle transitions")
public class CycleController {

    private final CycleAdminService adminService;
    private final CycleStateMachine stateMachine;
    private final EligibilityService eligibilityService;
    private final AutomationScheduler automationScheduler;

    public CycleController(CycleAdminService adminService,
                           CycleStateMachine stateMachine,
                           EligibilityService eligibilityService,
                           AutomationScheduler automationScheduler) {
        this.adminService = adminService;
        this.stateMachine = stateMachine;
        this.eligibilityService = eligibilityService;
        this.automationScheduler = automationScheduler;
    }

    @PostMapping("/cycles")
    @Operation(summary = "Create cycle", description = "Create a cycle in draft status")
    public Mono<ResponseEntity<CycleDto>> createCycle(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @RequestBody CycleDraft draft) {

        return Mono.fromCallable(() -> {
                    Actor actor = ActorResolver.resolve(actorId, roles);
                    return toDto(actor, adminService.createCycle(actor, draft));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping("/cycles")
    @Operation(summary = "List cycles", description = "List cycles with optional status filter")
    public Mono<ResponseEntity<CycleListResponse>> listCycles(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @Parameter(description = "Filter by status") @RequestParam(required = false) CycleStatus status,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            List<SuccessionCycle> filtered = adminService.listCycles().stream()
                    .filter(cycle -> status == null || cycle.getStatus() == status)
                    .toList();
            return ResponseEntity.ok(CycleListResponse.builder()
                    .cycles(filtered.stream()
                            .skip((long) page * size)
                            .limit(size)
                            .map(cycle -> toDto(actor, cycle))
                            .toList())
                    .total(filtered.size())
                    .page(page)
                    .size(size)
                    .build());
        });
    }

    @GetMapping("/cycles/{cycleId}")
    @Operation(summary = "Get cycle", description = "Get cycle details by ID")
    public Mono<ResponseEntity<CycleDto>> getCycle(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @Parameter(description = "Cycle ID") @PathVariable String cycleId) {

        return Mono.fromCallable(() -> ResponseEntity.ok(
                toDto(ActorResolver.resolve(actorId, roles), adminService.getCycle(cycleId))));
    }

    @GetMapping("/cycles/{cycleId}/history")
    @Operation(summary = "Get status history", description = "Every status change of the cycle, including overrides and reverts")
    public Mono<ResponseEntity<List<SuccessionCycle.StatusChange>>> getHistory(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            CycleLookup.requireAdmin(ActorResolver.resolve(actorId, roles), "view the status history");
            return ResponseEntity.ok(adminService.getCycle(cycleId).getStatusHistory());
        });
    }

    // ========== Settings ==========

    @PutMapping("/cycles/{cycleId}/committee")
    @Operation(summary = "Seat committee", description = "Replace the selection committee")
    public Mono<ResponseEntity<CycleDto>> configureCommittee(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody CommitteeRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(toDto(actor, adminService.configureCommittee(actor, cycleId, request.getMemberIds())));
        });
    }

    @PutMapping("/cycles/{cycleId}/deadlines")
    @Operation(summary = "Set deadlines", description = "Set when stages should be left; the scheduler acts on them")
    public Mono<ResponseEntity<CycleDto>> setDeadlines(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody Map<CycleStatus, Instant> deadlines) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(toDto(actor, adminService.setDeadlines(actor, cycleId, deadlines)));
        });
    }

    @PutMapping("/cycles/{cycleId}/applications-phase")
    @Operation(summary = "Toggle applications phase")
    public Mono<ResponseEntity<CycleDto>> setApplicationsPhase(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody ToggleRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(toDto(actor, adminService.setApplicationsPhase(actor, cycleId, request.isEnabled())));
        });
    }

    // ========== Positions ==========

    @GetMapping("/cycles/{cycleId}/positions")
    @Operation(summary = "List positions")
    public Mono<ResponseEntity<List<Position>>> listPositions(@PathVariable String cycleId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(adminService.listPositions(cycleId)));
    }

    @PostMapping("/cycles/{cycleId}/positions")
    @Operation(summary = "Add position", description = "Add a position; after activation an override reason is required")
    public Mono<ResponseEntity<Position>> addPosition(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @Parameter(description = "Required once the cycle is past active") @RequestParam(required = false) String overrideReason,
            @RequestBody PositionDraft draft) {

        return blocking(() -> adminService.addPosition(ActorResolver.resolve(actorId, roles), cycleId, draft, overrideReason))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/positions/{positionId}")
    @Operation(summary = "Update position")
    public Mono<ResponseEntity<Position>> updatePosition(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String positionId,
            @RequestParam(required = false) String overrideReason,
            @RequestBody PositionDraft draft) {

        return blocking(() -> ResponseEntity.ok(
                adminService.updatePosition(ActorResolver.resolve(actorId, roles), positionId, draft, overrideReason)));
    }

    @PostMapping("/positions/{positionId}/deactivate")
    @Operation(summary = "Deactivate position")
    public Mono<ResponseEntity<Position>> deactivatePosition(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String positionId,
            @RequestBody(required = false) ReasonRequest request) {

        return blocking(() -> ResponseEntity.ok(adminService.deactivatePosition(
                ActorResolver.resolve(actorId, roles), positionId, request != null ? request.getReason() : null)));
    }

    // ========== Lifecycle ==========

    @PostMapping("/cycles/{cycleId}/transitions")
    @Operation(summary = "Transition cycle", description = "Move the cycle to the given next status; all guards apply")
    public Mono<ResponseEntity<CycleDto>> transition(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody TransitionRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(toDto(actor,
                    stateMachine.transition(actor, cycleId, request.getTarget(), request.getExpectedVersion())));
        });
    }

    @PostMapping("/cycles/{cycleId}/advance")
    @Operation(summary = "Advance cycle", description = "Move the cycle to the next status on its path")
    public Mono<ResponseEntity<CycleDto>> advance(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody(required = false) TransitionRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            Long expectedVersion = request != null ? request.getExpectedVersion() : null;
            return ResponseEntity.ok(toDto(actor, stateMachine.advance(actor, cycleId, expectedVersion)));
        });
    }

    @PostMapping("/cycles/{cycleId}/force")
    @Operation(summary = "Force-close stage", description = "Transition bypassing overridable guards; reason required")
    public Mono<ResponseEntity<CycleDto>> forceTransition(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody TransitionRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(toDto(actor, stateMachine.forceTransition(actor, cycleId, request.getTarget(),
                    request.getExpectedVersion(), request.getReason())));
        });
    }

    @PostMapping("/cycles/{cycleId}/revert")
    @Operation(summary = "Revert stage", description = "Return to the previous status; reason required")
    public Mono<ResponseEntity<CycleDto>> revert(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody TransitionRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(toDto(actor,
                    stateMachine.revert(actor, cycleId, request.getExpectedVersion(), request.getReason())));
        });
    }

    @PostMapping("/cycles/{cycleId}/eligibility/recompute")
    @Operation(summary = "Recompute eligibility", description = "Recompute eligibility of all chapter members")
    public Mono<ResponseEntity<RecomputeReport>> recompute(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.defer(() -> eligibilityService.recompute(cycleId, ActorResolver.resolve(actorId, roles)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/cycles/{cycleId}/automation")
    @Operation(summary = "Automation status", description = "Consecutive failures and escalation flag of the scheduler")
    public Mono<ResponseEntity<AutomationStatus>> automationStatus(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            CycleLookup.requireAdmin(ActorResolver.resolve(actorId, roles), "view automation status");
            adminService.getCycle(cycleId);
            return ResponseEntity.ok(automationScheduler.status(cycleId));
        });
    }

    @PutMapping("/chapters/{chapterId}/members/{memberId}/activity")
    @Operation(summary = "Register member activity", description = "Feed the in-memory member directory")
    public Mono<ResponseEntity<Void>> registerActivity(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String chapterId,
            @PathVariable String memberId,
            @RequestBody MemberActivity activity) {

        return Mono.fromRunnable(() -> {
                    activity.setMemberId(memberId);
                    adminService.registerMemberActivity(ActorResolver.resolve(actorId, roles), chapterId, activity);
                })
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    private static CycleDto toDto(Actor actor, SuccessionCycle cycle) {
        return CycleMapper.toDto(cycle, actor.isAdmin() || cycle.isCommitteeMember(actor.id()));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class CommitteeRequest {
        private Set<String> memberIds;
    }

    @lombok.Data
    public static class ToggleRequest {
        private boolean enabled;
    }

    @lombok.Data
    public static class ReasonRequest {
        private String reason;
    }

    @lombok.Data
    public static class TransitionRequest {
        private CycleStatus target;
        private Long expectedVersion;
        private String reason;
    }
}
