package com.lodestar.succession.api.v1;

import com.lodestar.succession.api.ActorResolver;
import com.lodestar.succession.api.dto.CandidateScoreDto;
import com.lodestar.succession.api.mapper.RecordViewMapper;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.EvaluationCriterion;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.EvaluatorAssignment;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.evaluation.CriterionDefinition;
import com.lodestar.succession.evaluation.EvaluationService;
import com.lodestar.succession.evaluation.OutstandingScore;
import com.lodestar.succession.evaluation.ScoreSubmission;
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
 * REST API controller for rubrics, evaluator assignment, scoring and rankings.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/succession")
@Tag(name = "Evaluation", description = "Rubrics, evaluator assignment and scoring")
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final CycleLookup cycleLookup;
    private final RecordViewMapper viewMapper;

    public EvaluationController(EvaluationService evaluationService,
                                CycleLookup cycleLookup,
                                RecordViewMapper viewMapper) {
        this.evaluationService = evaluationService;
        this.cycleLookup = cycleLookup;
        this.viewMapper = viewMapper;
    }

    @PutMapping("/positions/{positionId}/rubric")
    @Operation(summary = "Define rubric", description = "Replace the rubric; weights must sum to 1. Locked once the roster is frozen")
    public Mono<ResponseEntity<List<EvaluationCriterion>>> defineRubric(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String positionId,
            @RequestBody List<CriterionDefinition> definitions) {

        return blocking(() -> ResponseEntity.ok(
                evaluationService.defineRubric(ActorResolver.resolve(actorId, roles), positionId, definitions)));
    }

    @GetMapping("/positions/{positionId}/rubric")
    @Operation(summary = "Get rubric")
    public Mono<ResponseEntity<List<EvaluationCriterion>>> getRubric(@PathVariable String positionId) {
        return Mono.fromCallable(() -> {
            cycleLookup.requirePosition(positionId);
            return ResponseEntity.ok(evaluationService.getRubric(positionId));
        });
    }

    @PostMapping("/cycles/{cycleId}/positions/{positionId}/assignments")
    @Operation(summary = "Assign evaluators", description = "Assign evaluators to candidates; conflicts are recused automatically")
    public Mono<ResponseEntity<List<EvaluatorAssignment>>> assignEvaluators(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId,
            @RequestBody AssignmentRequest request) {

        return blocking(() -> evaluationService.assignEvaluators(ActorResolver.resolve(actorId, roles), cycleId,
                positionId, request.getEvaluatorIds(), request.getCandidateIds()))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping("/positions/{positionId}/assignments")
    @Operation(summary = "List assignments", description = "Admin-only")
    public Mono<ResponseEntity<List<EvaluatorAssignment>>> listAssignments(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String positionId) {

        return Mono.fromCallable(() -> {
            CycleLookup.requireAdmin(ActorResolver.resolve(actorId, roles), "list evaluator assignments");
            cycleLookup.requirePosition(positionId);
            return ResponseEntity.ok(evaluationService.listAssignments(positionId));
        });
    }

    @PostMapping("/cycles/{cycleId}/positions/{positionId}/recusals")
    @Operation(summary = "Recuse evaluator", description = "The evaluator or an admin recuses from a candidate")
    public Mono<ResponseEntity<EvaluatorAssignment>> recuse(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId,
            @RequestBody RecusalRequest request) {

        return blocking(() -> ResponseEntity.ok(evaluationService.recuse(ActorResolver.resolve(actorId, roles),
                cycleId, positionId, request.getEvaluatorId(), request.getCandidateId(), request.getReason())));
    }

    @PostMapping("/cycles/{cycleId}/conflicts")
    @Operation(summary = "Declare conflict", description = "Record a close relation; future assignments are recused")
    public Mono<ResponseEntity<Void>> declareConflict(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody ConflictRequest request) {

        return Mono.fromRunnable(() -> evaluationService.declareConflict(ActorResolver.resolve(actorId, roles),
                        cycleId, request.getEvaluatorId(), request.getMemberId(), request.getReason()))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/cycles/{cycleId}/scores")
    @Operation(summary = "Submit score", description = "Insert or overwrite the evaluator's own score for one criterion")
    public Mono<ResponseEntity<EvaluationScore>> submitScore(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @RequestBody ScoreSubmission submission) {

        return blocking(() -> ResponseEntity.ok(
                evaluationService.submitScore(ActorResolver.resolve(actorId, roles), cycleId, submission)));
    }

    @GetMapping("/cycles/{cycleId}/scores/outstanding")
    @Operation(summary = "Outstanding scores", description = "Evaluator/candidate pairs still missing criteria; admin-only")
    public Mono<ResponseEntity<List<OutstandingScore>>> outstanding(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId) {

        return Mono.fromCallable(() -> {
            CycleLookup.requireAdmin(ActorResolver.resolve(actorId, roles), "list outstanding scores");
            return ResponseEntity.ok(evaluationService.outstandingScores(cycleId));
        });
    }

    @GetMapping("/cycles/{cycleId}/positions/{positionId}/rankings")
    @Operation(summary = "Rankings", description = "Weighted totals of the rostered candidates, redacted per viewer")
    public Mono<ResponseEntity<List<CandidateScoreDto>>> rankings(
            @RequestHeader(ActorResolver.ACTOR_ID_HEADER) String actorId,
            @RequestHeader(value = ActorResolver.ACTOR_ROLES_HEADER, required = false) String roles,
            @PathVariable String cycleId,
            @PathVariable String positionId) {

        return Mono.fromCallable(() -> {
            Actor actor = ActorResolver.resolve(actorId, roles);
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            return ResponseEntity.ok(viewMapper.rankings(actor, cycle, positionId,
                    evaluationService.rankings(cycleId, positionId), evaluationService.listScores(positionId)));
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class AssignmentRequest {
        private List<String> evaluatorIds;
        private List<String> candidateIds;
    }

    @lombok.Data
    public static class RecusalRequest {
        private String evaluatorId;
        private String candidateId;
        private String reason;
    }

    @lombok.Data
    public static class ConflictRequest {
        private String evaluatorId;
        private String memberId;
        private String reason;
    }
}
