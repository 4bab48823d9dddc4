package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.approach.ApproachRequest;
import com.lodestar.succession.approach.ApproachService;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CandidateApproach;
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
 * REST API controller for approaching selected candidates.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Approaches", description = "Asking candidates whether they will take the role")
public class ApproachController {

    private final ApproachService approachService;

    public ApproachController(ApproachService approachService) {
        this.approachService = approachService;
    }

    @PostMapping("/cycles/{cycleId}/approaches")
    @Operation(summary = "Record approach", description = "Admin records that a rostered candidate was approached")
    public Mono<ResponseEntity<CandidateApproach>> recordApproach(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody ApproachRequest request) {

        return blocking(() -> approachService.recordApproach(ActorResolver.resolve(actorId, roles), cycleId, request))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping("/cycles/{cycleId}/approaches")
    @Operation(summary = "List approaches", description = "All approaches for admins; own approaches otherwise")
    public Mono<ResponseEntity<List<CandidateApproach>>> listApproaches(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(approachService.listApproaches(cycleId).stream()
                    .filter(approach -> actor.isAdmin() || actor.id().equals(approach.getNomineeId()))
                    .toList());
        });
    }

    @PostMapping("/approaches/{approachId}/response")
    @Operation(summary = "Respond to approach", description = "The candidate or an admin records accepted, declined or conditional")
    public Mono<ResponseEntity<CandidateApproach>> respond(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String approachId,
            @RequestBody ResponseRequest request) {

        return blocking(() -> ResponseEntity.ok(approachService.respond(ActorResolver.resolve(actorId, roles),
                approachId, request.getResponseStatus(), request.getConditionsText(), request.getNotes())));
    }

    @DeleteMapping("/approaches/{approachId}")
    @Operation(summary = "Delete approach", description = "Only approaches that are still unanswered")
    public Mono<ResponseEntity<Void>> deleteApproach(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String approachId) {

        return blocking(() -> {
            approachService.deleteApproach(ActorResolver.resolve(actorId, roles), approachId);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    @lombok.Data
    public static class ResponseRequest {
        private CandidateApproach.ResponseStatus responseStatus;
        private String conditionsText;
        private String notes;
    }
}
