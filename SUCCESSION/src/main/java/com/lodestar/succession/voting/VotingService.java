package com.lodestar.succession.voting;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.*;
import com.lodestar.succession.domain.repository.ApproachRepository;
import com.lodestar.succession.domain.repository.MeetingRepository;
import com.lodestar.succession.domain.repository.NominationRepository;
import com.lodestar.succession.domain.repository.SelectionRepository;
import com.lodestar.succession.domain.repository.VoteRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.evaluation.CandidateScore;
import com.lodestar.succession.evaluation.EvaluationService;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Committee ballots and admin-confirmed selections.
 * <p>
 * Ballots are accepted only during selection and only from seated committee members writing
 * under their own identity, against an open steering committee or final selection meeting of the
 * cycle; a resubmission overwrites that member's ballot for the nominee. Selections are never
 * derived automatically from the tally, and a candidate who declined the approach for the
 * position cannot be selected.
 */
@Slf4j
@Service
public class VotingService {

    private final VoteRepository voteRepository;
    private final SelectionRepository selectionRepository;
    private final NominationRepository nominationRepository;
    private final MeetingRepository meetingRepository;
    private final ApproachRepository approachRepository;
    private final EvaluationService evaluationService;
    private final VoteTallyEngine tallyEngine;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final ChapterPolicyResolver policyResolver;
    private final AuditService auditService;
    private final SuccessionMetrics metrics;
    private final Clock clock;

    public VotingService(VoteRepository voteRepository,
                         SelectionRepository selectionRepository,
                         NominationRepository nominationRepository,
                         MeetingRepository meetingRepository,
                         ApproachRepository approachRepository,
                         EvaluationService evaluationService,
                         VoteTallyEngine tallyEngine,
                         CycleLookup cycleLookup,
                         CycleLockRegistry locks,
                         ChapterPolicyResolver policyResolver,
                         AuditService auditService,
                         SuccessionMetrics metrics,
                         Clock clock) {
        this.voteRepository = voteRepository;
        this.selectionRepository = selectionRepository;
        this.nominationRepository = nominationRepository;
        this.meetingRepository = meetingRepository;
        this.approachRepository = approachRepository;
        this.evaluationService = evaluationService;
        this.tallyEngine = tallyEngine;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.policyResolver = policyResolver;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Vote castVote(Actor actor, String cycleId, BallotRequest request) {
        if (request.getVoterId() != null && !request.getVoterId().equals(actor.id())) {
            throw new ConflictException("A ballot can only be cast under the voter's own identity");
        }
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, CycleStatus::acceptsBallots, "Voting");
            if (!cycle.isCommitteeMember(actor.id())) {
                throw new AuthorizationException(actor.id() + " is not on the selection committee", cycle.getStatus());
            }
            Position position = cycleLookup.requireActivePosition(cycle, request.getPositionId());
            Map<String, String> errors = new LinkedHashMap<>();
            if (request.getValue() == null) {
                errors.put("value", "is required");
            }
            if (!ballotCandidates(cycle, position.getId()).contains(request.getNomineeId())) {
                errors.put("nomineeId", "not a candidate for " + position.getTitle());
            }
            Optional<Meeting> meeting = request.getMeetingId() == null || request.getMeetingId().isBlank()
                    ? Optional.empty()
                    : meetingRepository.findById(request.getMeetingId()).filter(found -> cycleId.equals(found.getCycleId()));
            if (meeting.isEmpty()) {
                errors.put("meetingId", "must name a meeting of this cycle");
            } else if (!meeting.get().getMeetingType().isVoting()) {
                errors.put("meetingId", meeting.get().getMeetingType() + " meetings do not take ballots");
            }
            ValidationException.throwIfAny(errors, cycle.getStatus());
            if (!meeting.get().getStatus().isOpen()) {
                throw new ConflictException("Meeting " + request.getMeetingId() + " is " + meeting.get().getStatus(),
                        cycle.getStatus());
            }

            Vote vote = Vote.builder()
                    .meetingId(request.getMeetingId())
                    .cycleId(cycleId)
                    .positionId(position.getId())
                    .nomineeId(request.getNomineeId())
                    .voterId(actor.id())
                    .value(request.getValue())
                    .comments(request.getComments())
                    .castAt(clock.instant())
                    .build();
            Vote stored = voteRepository.upsert(vote);
            metrics.recordBallot();
            auditService.record(cycleId, actor, "vote.cast", "Vote",
                    position.getId() + "/" + request.getNomineeId() + "/" + actor.id(),
                    "Ballot " + request.getValue(), null, stored);
            return stored;
        });
    }

    /**
     * Current tally and quorum outcome for a position.
     */
    public SelectionResolution resolve(String cycleId, String positionId) {
        SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
        Position position = cycleLookup.requireActivePosition(cycle, positionId);
        Map<String, Double> evaluationScores = evaluationService.rankings(cycleId, position.getId()).stream()
                .collect(Collectors.toMap(CandidateScore::getCandidateId, CandidateScore::getTotal));
        return tallyEngine.resolve(position.getId(), ballotCandidates(cycle, position.getId()),
                voteRepository.findByPosition(position.getId()), cycle.getSelectionCommitteeIds(),
                evaluationScores, policyResolver.forCycle(cycle));
    }

    public List<Vote> listVotes(String positionId) {
        return voteRepository.findByPosition(positionId);
    }

    /**
     * Record the admin's decision for a position. A candidate that did not clear quorum can only
     * be chosen with an override reason.
     */
    public Selection recordSelection(Actor actor, String cycleId, String positionId, String candidateId,
                                     String rationale, String overrideReason) {
        CycleLookup.requireAdmin(actor, "record a selection");
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, CycleStatus::acceptsBallots, "Selection");
            Position position = cycleLookup.requireActivePosition(cycle, positionId);
            if (!ballotCandidates(cycle, positionId).contains(candidateId)) {
                throw new ValidationException(Map.of("candidateId", candidateId + " is not a candidate for "
                        + position.getTitle()), cycle.getStatus());
            }
            boolean declined = approachRepository.findByPositionAndNominee(positionId, candidateId)
                    .map(approach -> approach.getResponseStatus() == CandidateApproach.ResponseStatus.DECLINED)
                    .orElse(false);
            if (declined) {
                throw new ConflictException(candidateId + " declined the approach for " + position.getTitle(),
                        cycle.getStatus());
            }
            SelectionResolution resolution = resolve(cycleId, positionId);
            boolean override = !resolution.getQualifying().contains(candidateId);
            if (override && (overrideReason == null || overrideReason.isBlank())) {
                throw new ValidationException(Map.of("overrideReason",
                        candidateId + " did not clear quorum; an override reason is required"), cycle.getStatus());
            }
            Selection selection = Selection.builder()
                    .id(UUID.randomUUID().toString())
                    .cycleId(cycleId)
                    .positionId(positionId)
                    .candidateId(candidateId)
                    .rationale(override ? overrideReason.trim() : rationale)
                    .decidedBy(actor.id())
                    .decidedAt(clock.instant())
                    .override(override)
                    .active(true)
                    .build();
            if (!selectionRepository.insertActive(selection)) {
                throw new ConflictException("Position " + position.getTitle()
                        + " already has an active selection; revoke it first", cycle.getStatus());
            }
            metrics.recordSelection();
            if (override) {
                metrics.recordOverride();
                log.warn("Selection override for position {}: candidate {} chosen without quorum by {}: {}",
                        positionId, candidateId, actor.id(), overrideReason);
            }
            auditService.record(cycleId, actor, override ? "selection.override" : "selection.record", "Selection",
                    selection.getId(), (override ? "Override: " + overrideReason.trim() : "Selected " + candidateId),
                    null, selection);
            return selection;
        });
    }

    public Selection revokeSelection(Actor actor, String selectionId, String reason) {
        CycleLookup.requireAdmin(actor, "revoke a selection");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }
        Selection existing = selectionRepository.findById(selectionId)
                .orElseThrow(() -> new NotFoundException("Selection", selectionId));
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, CycleStatus::acceptsBallots, "Selection revocation");
            Selection current = selectionRepository.findById(selectionId).orElseThrow();
            if (!current.isActive()) {
                throw new ConflictException("Selection " + selectionId + " is already revoked", cycle.getStatus());
            }
            Instant now = clock.instant();
            Selection revoked = current.toBuilder()
                    .active(false)
                    .revokedAt(now)
                    .revokedBy(actor.id())
                    .revocationReason(reason.trim())
                    .build();
            selectionRepository.update(revoked);
            auditService.record(cycle.getId(), actor, "selection.revoke", "Selection", selectionId,
                    "Revoked: " + reason.trim(), current, revoked);
            return revoked;
        });
    }

    public List<Selection> listSelections(String cycleId) {
        return selectionRepository.findByCycle(cycleId);
    }

    public Optional<Selection> activeSelection(String positionId) {
        return selectionRepository.findActiveByPosition(positionId);
    }

    private List<String> ballotCandidates(SuccessionCycle cycle, String positionId) {
        List<String> roster = cycle.frozenRoster(positionId);
        return nominationRepository.findByPositionId(positionId).stream()
                .filter(Nomination::isActiveCandidate)
                .map(Nomination::getNomineeId)
                .filter(roster::contains)
                .collect(Collectors.toList());
    }
}
