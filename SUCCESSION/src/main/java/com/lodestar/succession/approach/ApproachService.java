package com.lodestar.succession.approach;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CandidateApproach;
import com.lodestar.succession.domain.model.CandidateApproach.ResponseStatus;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.ApproachRepository;
import com.lodestar.succession.domain.repository.NominationRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.notification.NotificationTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Approaches to shortlisted candidates during selection and approval.
 * <p>
 * An admin records that a rostered candidate was sounded out; the candidate (or an admin on
 * their behalf) records the answer. A conditional answer must state its conditions.
 */
@Slf4j
@Service
public class ApproachService {

    static final int MAX_CONDITIONS = 1000;
    static final int MAX_NOTES = 2000;

    private final ApproachRepository approachRepository;
    private final NominationRepository nominationRepository;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public ApproachService(ApproachRepository approachRepository,
                           NominationRepository nominationRepository,
                           CycleLookup cycleLookup,
                           CycleLockRegistry locks,
                           AuditService auditService,
                           NotificationDispatcher notificationDispatcher,
                           Clock clock) {
        this.approachRepository = approachRepository;
        this.nominationRepository = nominationRepository;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    public CandidateApproach recordApproach(Actor actor, String cycleId, ApproachRequest request) {
        CycleLookup.requireAdmin(actor, "approach candidates");
        if (request.getNotes() != null && request.getNotes().length() > MAX_NOTES) {
            throw new ValidationException("notes", "at most " + MAX_NOTES + " characters");
        }
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, ApproachService::acceptsApproaches, "Candidate approach");
            Position position = cycleLookup.requireActivePosition(cycle, request.getPositionId());
            boolean rostered = nominationRepository.findByPositionAndNominee(position.getId(), request.getNomineeId())
                    .map(Nomination::isActiveCandidate)
                    .orElse(false)
                    && cycle.frozenRoster(position.getId()).contains(request.getNomineeId());
            if (!rostered) {
                throw new ValidationException(Map.of("nomineeId",
                        request.getNomineeId() + " is not a rostered candidate for " + position.getTitle()), cycle.getStatus());
            }

            Instant now = clock.instant();
            CandidateApproach approach = CandidateApproach.builder()
                    .id(UUID.randomUUID().toString())
                    .cycleId(cycleId)
                    .positionId(position.getId())
                    .nomineeId(request.getNomineeId())
                    .approachedBy(actor.id())
                    .approachedAt(now)
                    .responseStatus(ResponseStatus.PENDING)
                    .notes(request.getNotes())
                    .updatedAt(now)
                    .build();
            if (!approachRepository.insert(approach)) {
                throw new ConflictException(request.getNomineeId() + " was already approached for " + position.getTitle(),
                        cycle.getStatus());
            }
            auditService.record(cycleId, actor, "approach.create", "CandidateApproach", approach.getId(),
                    "Approached " + approach.getNomineeId() + " for " + position.getTitle(), null, approach);
            notificationDispatcher.dispatch(NotificationRequest.of(approach.getNomineeId(),
                    NotificationTemplate.CANDIDATE_APPROACHED,
                    Map.of("cycleId", cycleId, "positionId", position.getId(), "positionTitle", position.getTitle(),
                            "approachId", approach.getId())));
            return approach;
        });
    }

    /**
     * Record the candidate's answer. Allowed for the approached candidate and admins.
     */
    public CandidateApproach respond(Actor actor, String approachId, ResponseStatus status,
                                     String conditionsText, String notes) {
        CandidateApproach existing = requireApproach(approachId);
        if (!actor.isAdmin() && !actor.id().equals(existing.getNomineeId())) {
            throw new AuthorizationException("Only the approached candidate or an admin may record the response");
        }
        Map<String, String> errors = new LinkedHashMap<>();
        if (status == null) {
            errors.put("responseStatus", "is required");
        }
        boolean hasConditions = conditionsText != null && !conditionsText.isBlank();
        if (status == ResponseStatus.CONDITIONAL && !hasConditions) {
            errors.put("conditionsText", "is required for a conditional response");
        } else if (hasConditions && conditionsText.length() > MAX_CONDITIONS) {
            errors.put("conditionsText", "at most " + MAX_CONDITIONS + " characters");
        }
        if (notes != null && notes.length() > MAX_NOTES) {
            errors.put("notes", "at most " + MAX_NOTES + " characters");
        }
        ValidationException.throwIfAny(errors, null);

        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, ApproachService::acceptsApproaches, "Approach response");
            Instant now = clock.instant();
            CandidateApproach updated = approachRepository.update(approachId, current -> current.toBuilder()
                    .responseStatus(status)
                    .responseDate(now)
                    .conditionsText(hasConditions ? conditionsText.trim() : null)
                    .notes(notes != null && !notes.isBlank() ? notes.trim() : current.getNotes())
                    .updatedAt(now)
                    .build());
            if (updated == null) {
                throw new NotFoundException("CandidateApproach", approachId);
            }
            auditService.record(cycle.getId(), actor, "approach.respond", "CandidateApproach", approachId,
                    "Response " + status, existing.getResponseStatus(), status);
            if (status == ResponseStatus.DECLINED) {
                log.info("Candidate {} declined the approach for position {}", updated.getNomineeId(), updated.getPositionId());
            }
            return updated;
        });
    }

    /**
     * Remove an approach that has not been answered yet.
     */
    public void deleteApproach(Actor actor, String approachId) {
        CycleLookup.requireAdmin(actor, "delete candidate approaches");
        CandidateApproach existing = requireApproach(approachId);
        locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            CandidateApproach current = requireApproach(approachId);
            if (current.getResponseStatus() != ResponseStatus.PENDING) {
                throw new ConflictException("Approach " + approachId + " was already answered", cycle.getStatus());
            }
            approachRepository.delete(approachId);
            auditService.record(cycle.getId(), actor, "approach.delete", "CandidateApproach", approachId,
                    "Deleted approach of " + current.getNomineeId(), current, null);
            return null;
        });
    }

    public CandidateApproach requireApproach(String approachId) {
        return approachRepository.findById(approachId)
                .orElseThrow(() -> new NotFoundException("CandidateApproach", approachId));
    }

    public List<CandidateApproach> listApproaches(String cycleId) {
        cycleLookup.requireCycle(cycleId);
        return approachRepository.findByCycle(cycleId);
    }

    private static boolean acceptsApproaches(CycleStatus status) {
        return status == CycleStatus.SELECTION || status == CycleStatus.APPROVAL_PENDING;
    }
}
