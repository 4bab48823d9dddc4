package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.api.dto.ResolutionDto;
import com.lodestar.succession.api.dto.SelectionDto;
import com.lodestar.succession.api.mapper.RecordViewMapper;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.Selection;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.model.Vote;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.voting.BallotRequest;
import com.lodestar.succession.voting.VotingService;
import io.swagger.v3.oas.annotations.Operation;
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

/**
 * REST API controller for ballots, tallies and selections.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Voting", description = "Committee ballots, quorum resolution and selections")
public class VotingController {

    private final VotingService votingService;
    private final CycleLookup cycleLookup;
    private final RecordViewMapper viewMapper;

    public VotingController(VotingService votingService,
                            CycleLookup cycleLookup,
                            RecordViewMapper viewMapper) {
        this.votingService = votingService;
        this.cycleLookup = cycleLookup;
        this.viewMapper = viewMapper;
    }

    @PostMapping("/cycles/{cycleId}/ballots")
    @Operation(summary = "Cast ballot", description = "Committee member casts or replaces their own ballot")
    public Mono<ResponseEntity<Vote>> castVote(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody BallotRequest request) {

        return blocking(() -> ResponseEntity.ok(
                votingService.castVote(ActorResolver.resolve(actorId, roles), cycleId, request)));
    }

    @GetMapping("/cycles/{cycleId}/positions/{positionId}/ballots/mine")
    @Operation(summary = "My ballots", description = "The viewer's own ballots for a position")
    public Mono<ResponseEntity<List<Vote>>> myVotes(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            cycleLookup.requireActivePosition(cycleLookup.requireCycle(cycleId), positionId);
            return ResponseEntity.ok(votingService.listVotes(positionId).stream()
                    .filter(vote -> vote.getVoterId().equals(actor.id()))
                    .toList());
        });
    }

    @GetMapping("/cycles/{cycleId}/positions/{positionId}/resolution")
    @Operation(summary = "Resolve vote", description = "Tallies and quorum outcome; never records a selection")
    public Mono<ResponseEntity<ResolutionDto>> resolve(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            return viewMapper.resolution(actor, cycle, votingService.resolve(cycleId, positionId),
                            votingService.listVotes(positionId))
                    .map(ResponseEntity::ok)
                    .orElseThrow(() -> new AuthorizationException("Tallies are not visible while the cycle is "
                            + cycle.getStatus(), cycle.getStatus()));
        });
    }

    @PostMapping("/cycles/{cycleId}/positions/{positionId}/selection")
    @Operation(summary = "Record selection", description = "Admin confirms the selection; a non-qualifier needs an override reason")
    public Mono<ResponseEntity<SelectionDto>> recordSelection(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId,
            @RequestBody SelectionRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            Selection selection = votingService.recordSelection(actor, cycleId, positionId, request.getCandidateId(),
                    request.getRationale(), request.getOverrideReason());
            return view(actor, selection);
        }).map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PostMapping("/selections/{selectionId}/revoke")
    @Operation(summary = "Revoke selection", description = "Admin-only; reason required")
    public Mono<ResponseEntity<SelectionDto>> revokeSelection(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String selectionId,
            @RequestBody ReasonRequest request) {

        return blocking(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            return ResponseEntity.ok(view(actor, votingService.revokeSelection(actor, selectionId, request.getReason())));
        });
    }

    @GetMapping("/cycles/{cycleId}/selections")
    @Operation(summary = "List selections", description = "Selections visible to the viewer")
    public Mono<ResponseEntity<List<SelectionDto>>> listSelections(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            return ResponseEntity.ok(votingService.listSelections(cycleId).stream()
                    .map(selection -> viewMapper.selection(actor, cycle, selection))
                    .flatMap(Optional::stream)
                    .toList());
        });
    }

    private SelectionDto view(Actor actor, Selection selection) {
        SuccessionCycle cycle = cycleLookup.requireCycle(selection.getCycleId());
        return viewMapper.selection(actor, cycle, selection)
                .orElseThrow(() -> new AuthorizationException("Selection is not visible"));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class SelectionRequest {
        private String candidateId;
        private String rationale;
        private String overrideReason;
    }

    @lombok.Data
    public static class ReasonRequest {
        private String reason;
    }
}
