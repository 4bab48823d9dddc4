package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.api.dto.EligibilityRecordDto;
import com.lodestar.succession.api.dto.NominationDto;
import com.lodestar.succession.api.mapper.RecordViewMapper;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.eligibility.EligibilityService;
import com.lodestar.succession.nomination.CandidacySubmission;
import com.lodestar.succession.nomination.NominationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

/**
 * REST API controller for nominations, applications and secondments, plus eligibility lookups.
 * Responses are redacted to what the viewer may see at the cycle's current stage.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Candidacies", description = "Nomination, application and secondment intake")
public class NominationController {

    private final NominationService nominationService;
    private final EligibilityService eligibilityService;
    private final CycleLookup cycleLookup;
    private final RecordViewMapper viewMapper;

    public NominationController(NominationService nominationService,
                                EligibilityService eligibilityService,
                                CycleLookup cycleLookup,
                                RecordViewMapper viewMapper) {
        this.nominationService = nominationService;
        this.eligibilityService = eligibilityService;
        this.cycleLookup = cycleLookup;
        this.viewMapper = viewMapper;
    }

    @PostMapping("/cycles/{cycleId}/nominations")
    @Operation(summary = "Nominate", description = "Put another member forward for a position")
    public Mono<ResponseEntity<NominationDto>> nominate(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody CandidacySubmission submission) {
        return submit(actorId, roles, cycleId, submission,
                (actor, body) -> nominationService.nominate(actor, cycleId, body));
    }

    @PostMapping("/cycles/{cycleId}/applications")
    @Operation(summary = "Apply", description = "Apply for a position as the acting member")
    public Mono<ResponseEntity<NominationDto>> apply(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody CandidacySubmission submission) {
        return submit(actorId, roles, cycleId, submission,
                (actor, body) -> nominationService.apply(actor, cycleId, body));
    }

    @PostMapping("/cycles/{cycleId}/secondments")
    @Operation(summary = "Propose secondment", description = "Propose a member, who must consent before standing")
    public Mono<ResponseEntity<NominationDto>> second(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody CandidacySubmission submission) {
        return submit(actorId, roles, cycleId, submission,
                (actor, body) -> nominationService.second(actor, cycleId, body));
    }

    @GetMapping("/cycles/{cycleId}/nominations")
    @Operation(summary = "List candidacies", description = "Candidacies of the cycle visible to the viewer")
    public Mono<ResponseEntity<List<NominationDto>>> listNominations(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @Parameter(description = "Filter by position") @RequestParam(required = false) String positionId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            List<Nomination> nominations = nominationService.listByCycle(cycleId).stream()
                    .filter(nomination -> positionId == null || positionId.equals(nomination.getPositionId()))
                    .toList();
            return ResponseEntity.ok(viewMapper.nominations(actor, cycle, nominations));
        });
    }

    @GetMapping("/nominations/{nominationId}")
    @Operation(summary = "Get candidacy")
    public Mono<ResponseEntity<NominationDto>> getNomination(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String nominationId) {

        return Mono.fromCallable(() -> ResponseEntity.ok(
                view(ActorResolver.resolve(actorId, roles), nominationService.requireNomination(nominationId))));
    }

    @PostMapping("/nominations/{nominationId}/consent")
    @Operation(summary = "Answer secondment", description = "Nominee accepts or declines a secondment")
    public Mono<ResponseEntity<NominationDto>> respond(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String nominationId,
            @RequestBody ConsentRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(view(actor, nominationService.respondToSecondment(actor, nominationId, request.isAccept())));
        });
    }

    @PostMapping("/nominations/{nominationId}/withdraw")
    @Operation(summary = "Withdraw candidacy", description = "Nominee, nominator or admin withdraws; reason required")
    public Mono<ResponseEntity<NominationDto>> withdraw(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String nominationId,
            @RequestBody ReasonRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(view(actor, nominationService.withdraw(actor, nominationId, request.getReason())));
        });
    }

    @PostMapping("/nominations/{nominationId}/disqualify")
    @Operation(summary = "Disqualify candidacy", description = "Admin-only; reason required")
    public Mono<ResponseEntity<NominationDto>> disqualify(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String nominationId,
            @RequestBody ReasonRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(view(actor, nominationService.disqualify(actor, nominationId, request.getReason())));
        });
    }

    @GetMapping("/cycles/{cycleId}/positions/{positionId}/eligibility")
    @Operation(summary = "List eligibility", description = "Eligibility records of a position visible to the viewer")
    public Mono<ResponseEntity<List<EligibilityRecordDto>>> listEligibility(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireActivePosition(cycle, positionId);
            return ResponseEntity.ok(eligibilityService.listRecords(positionId).stream()
                    .map(record -> viewMapper.eligibility(actor, cycle, record))
                    .flatMap(Optional::stream)
                    .toList());
        });
    }

    @GetMapping("/cycles/{cycleId}/positions/{positionId}/eligibility/{memberId}")
    @Operation(summary = "Get eligibility", description = "Eligibility of one member, with reasons for the member and admins")
    public Mono<ResponseEntity<EligibilityRecordDto>> getEligibility(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId,
            @PathVariable String memberId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireActivePosition(cycle, positionId);
            return eligibilityService.findRecord(positionId, memberId)
                    .flatMap(record -> viewMapper.eligibility(actor, cycle, record))
                    .map(ResponseEntity::ok)
                    .orElseThrow(() -> new NotFoundException("EligibilityRecord", positionId + "/" + memberId));
        });
    }

    private Mono<ResponseEntity<NominationDto>> submit(String actorId, String roles, String cycleId,
                                                       CandidacySubmission submission,
                                                       BiFunction<Actor, CandidacySubmission, Nomination> action) {
        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return view(actor, action.apply(actor, submission));
        }).map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    private NominationDto view(Actor actor, Nomination nomination) {
        SuccessionCycle cycle = cycleLookup.requireCycle(nomination.getCycleId());
        return viewMapper.nomination(actor, cycle, nomination)
                .orElseThrow(() -> new NotFoundException("Nomination", nomination.getId()));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class ConsentRequest {
        private boolean accept;
    }

    @lombok.Data
    public static class ReasonRequest {
        private String reason;
    }
}
