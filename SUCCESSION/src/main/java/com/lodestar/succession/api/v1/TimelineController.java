package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.domain.model.TimelineStep;
import com.lodestar.succession.timeline.TimelineService;
import com.lodestar.succession.timeline.TimelineStepRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST API controller for the published cycle timeline.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Timeline", description = "Week-by-week cycle timeline")
public class TimelineController {

    private final TimelineService timelineService;

    public TimelineController(TimelineService timelineService) {
        this.timelineService = timelineService;
    }

    @GetMapping("/cycles/{cycleId}/timeline")
    @Operation(summary = "Get timeline", description = "Steps in step-number order")
    public Mono<ResponseEntity<List<TimelineStep>>> listSteps(@PathVariable String cycleId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(timelineService.listSteps(cycleId)));
    }

    @PostMapping("/cycles/{cycleId}/timeline/seed")
    @Operation(summary = "Seed timeline", description = "Lay out the seven standard one-week steps")
    public Mono<ResponseEntity<List<TimelineStep>>> seed(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody(required = false) SeedRequest request) {

        LocalDate startDate = request != null ? request.getStartDate() : null;
        return blocking(() -> timelineService.seedTimeline(ActorResolver.resolve(actorId, roles), cycleId, startDate))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PostMapping("/cycles/{cycleId}/timeline")
    @Operation(summary = "Add timeline step")
    public Mono<ResponseEntity<TimelineStep>> createStep(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody TimelineStepRequest request) {

        return blocking(() -> timelineService.createStep(ActorResolver.resolve(actorId, roles), cycleId, request))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PostMapping("/timeline/{stepId}/status")
    @Operation(summary = "Update step status")
    public Mono<ResponseEntity<TimelineStep>> updateStatus(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String stepId,
            @RequestBody StatusRequest request) {

        return blocking(() -> ResponseEntity.ok(timelineService.updateStepStatus(
                ActorResolver.resolve(actorId, roles), stepId, request.getStatus())));
    }

    @DeleteMapping("/timeline/{stepId}")
    @Operation(summary = "Delete timeline step")
    public Mono<ResponseEntity<Void>> deleteStep(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String stepId) {

        return blocking(() -> {
            timelineService.deleteStep(ActorResolver.resolve(actorId, roles), stepId);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    @lombok.Data
    public static class SeedRequest {
        private LocalDate startDate;
    }

    @lombok.Data
    public static class StatusRequest {
        private TimelineStep.StepStatus status;
    }
}
