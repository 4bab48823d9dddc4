package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.Meeting;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.meeting.MeetingRequest;
import com.lodestar.succession.meeting.MeetingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST API controller for selection committee meetings.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Meetings", description = "Committee meetings that ballots are cast at")
public class MeetingController {

    private final MeetingService meetingService;
    private final CycleLookup cycleLookup;

    public MeetingController(MeetingService meetingService, CycleLookup cycleLookup) {
        this.meetingService = meetingService;
        this.cycleLookup = cycleLookup;
    }

    @PostMapping("/cycles/{cycleId}/meetings")
    @Operation(summary = "Schedule meeting", description = "Admin schedules a committee, review or interview meeting")
    public Mono<ResponseEntity<Meeting>> createMeeting(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody MeetingRequest request) {

        return blocking(() -> meetingService.createMeeting(ActorResolver.resolve(actorId, roles), cycleId, request))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping("/cycles/{cycleId}/meetings")
    @Operation(summary = "List meetings", description = "Admins and the selection committee only")
    public Mono<ResponseEntity<List<Meeting>>> listMeetings(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            if (!actor.isAdmin() && !cycle.isCommitteeMember(actor.id())) {
                return ResponseEntity.ok(List.<Meeting>of());
            }
            return ResponseEntity.ok(meetingService.listMeetings(cycleId));
        });
    }

    @PostMapping("/meetings/{meetingId}/status")
    @Operation(summary = "Update meeting status", description = "scheduled -> in_progress -> completed; cancel before completion")
    public Mono<ResponseEntity<Meeting>> updateStatus(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String meetingId,
            @RequestBody StatusRequest request) {

        return blocking(() -> ResponseEntity.ok(meetingService.updateMeetingStatus(
                ActorResolver.resolve(actorId, roles), meetingId, request.getStatus())));
    }

    @DeleteMapping("/meetings/{meetingId}")
    @Operation(summary = "Delete meeting", description = "Only scheduled meetings without ballots")
    public Mono<ResponseEntity<Void>> deleteMeeting(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String meetingId) {

        return blocking(() -> {
            meetingService.deleteMeeting(ActorResolver.resolve(actorId, roles), meetingId);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    @lombok.Data
    public static class StatusRequest {
        private Meeting.MeetingStatus status;
    }
}
