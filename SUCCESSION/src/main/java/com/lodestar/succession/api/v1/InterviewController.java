package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.api.dto.FeedbackDto;
import com.lodestar.succession.api.mapper.RecordViewMapper;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.InterviewFeedback;
import com.lodestar.succession.domain.model.InterviewSlot;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.interview.FeedbackRequest;
import com.lodestar.succession.interview.InterviewService;
import com.lodestar.succession.interview.SlotRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST API controller for interview slots and panel feedback.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Interviews", description = "Interview scheduling and feedback")
public class InterviewController {

    private final InterviewService interviewService;
    private final CycleLookup cycleLookup;
    private final RecordViewMapper viewMapper;

    public InterviewController(InterviewService interviewService,
                               CycleLookup cycleLookup,
                               RecordViewMapper viewMapper) {
        this.interviewService = interviewService;
        this.cycleLookup = cycleLookup;
        this.viewMapper = viewMapper;
    }

    @PostMapping("/cycles/{cycleId}/interviews")
    @Operation(summary = "Schedule interview", description = "Admin assigns a slot and panel to a rostered candidate")
    public Mono<ResponseEntity<InterviewSlot>> schedule(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody SlotRequest request) {

        return blocking(() -> interviewService.schedule(ActorResolver.resolve(actorId, roles), cycleId, request))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping("/cycles/{cycleId}/interviews")
    @Operation(summary = "List interviews", description = "All slots for admins; own slots as candidate or panelist otherwise")
    public Mono<ResponseEntity<List<InterviewSlot>>> listSlots(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            cycleLookup.requireCycle(cycleId);
            return ResponseEntity.ok(interviewService.listSlots(cycleId).stream()
                    .filter(slot -> actor.isAdmin()
                            || actor.id().equals(slot.getCandidateId())
                            || slot.getPanelMemberIds().contains(actor.id()))
                    .toList());
        });
    }

    @PostMapping("/interviews/{slotId}/reschedule")
    @Operation(summary = "Reschedule interview", description = "Move a slot to a new future time; reason required")
    public Mono<ResponseEntity<InterviewSlot>> reschedule(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String slotId,
            @RequestBody RescheduleRequest request) {

        return blocking(() -> ResponseEntity.ok(interviewService.reschedule(ActorResolver.resolve(actorId, roles),
                slotId, request.getScheduledAt(), request.getReason())));
    }

    @PostMapping("/interviews/{slotId}/attendance")
    @Operation(summary = "Record attendance")
    public Mono<ResponseEntity<InterviewSlot>> recordAttendance(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String slotId,
            @RequestBody AttendanceRequest request) {

        return blocking(() -> ResponseEntity.ok(interviewService.recordAttendance(
                ActorResolver.resolve(actorId, roles), slotId, request.getAttendance())));
    }

    @PostMapping("/interviews/{slotId}/feedback")
    @Operation(summary = "Submit feedback", description = "Panelists only, after the slot has ended")
    public Mono<ResponseEntity<InterviewFeedback>> submitFeedback(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String slotId,
            @RequestBody FeedbackRequest request) {

        return blocking(() -> ResponseEntity.ok(
                interviewService.submitFeedback(ActorResolver.resolve(actorId, roles), slotId, request)));
    }

    @GetMapping("/interviews/{slotId}/feedback")
    @Operation(summary = "List feedback", description = "Panel feedback of a slot, redacted per viewer")
    public Mono<ResponseEntity<List<FeedbackDto>>> listFeedback(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String slotId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            InterviewSlot slot = interviewService.requireSlot(slotId);
            return ResponseEntity.ok(viewMapper.feedback(actor, cycleLookup.requireCycle(slot.getCycleId()), slot,
                    interviewService.listFeedback(slotId)));
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class RescheduleRequest {
        private Instant scheduledAt;
        private String reason;
    }

    @lombok.Data
    public static class AttendanceRequest {
        private InterviewSlot.Attendance attendance;
    }
}
