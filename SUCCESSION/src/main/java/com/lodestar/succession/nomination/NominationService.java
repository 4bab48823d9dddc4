package com.lodestar.succession.nomination;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.*;
import com.lodestar.succession.domain.model.Nomination.CandidacySource;
import com.lodestar.succession.domain.model.Nomination.CandidacyStatus;
import com.lodestar.succession.domain.model.Nomination.ConsentStatus;
import com.lodestar.succession.domain.model.Nomination.EvidenceItem;
import com.lodestar.succession.domain.repository.NominationRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.eligibility.EligibilityService;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.observability.SuccessionStructuredLogger;
import com.lodestar.succession.observability.SuccessionStructuredLogger.CandidacyEventType;
import com.lodestar.succession.policy.ChapterPolicy;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;

/**
 * Intake of candidacies: third-party nominations, self-applications and secondments.
 * <p>
 * One candidacy exists per (position, nominee). A repeated submission for a live candidacy
 * merges its evidence and records the submitter as co-nominator; a submission for a withdrawn
 * candidacy re-activates it; a disqualified candidacy accepts no further submissions.
 */
@Slf4j
@Service
public class NominationService {

    private final NominationRepository nominationRepository;
    private final EligibilityService eligibilityService;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final ChapterPolicyResolver policyResolver;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final SuccessionMetrics metrics;
    private final SuccessionStructuredLogger structuredLogger;
    private final Clock clock;

    public NominationService(NominationRepository nominationRepository,
                             EligibilityService eligibilityService,
                             CycleLookup cycleLookup,
                             CycleLockRegistry locks,
                             ChapterPolicyResolver policyResolver,
                             AuditService auditService,
                             NotificationDispatcher notificationDispatcher,
                             SuccessionMetrics metrics,
                             SuccessionStructuredLogger structuredLogger,
                             Clock clock) {
        this.nominationRepository = nominationRepository;
        this.eligibilityService = eligibilityService;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.policyResolver = policyResolver;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    public Nomination nominate(Actor actor, String cycleId, CandidacySubmission submission) {
        return submit(actor, cycleId, submission, CandidacySource.NOMINATION);
    }

    /**
     * Self-application; the acting member is the nominee.
     */
    public Nomination apply(Actor actor, String cycleId, CandidacySubmission submission) {
        submission.setNomineeId(actor.id());
        return submit(actor, cycleId, submission, CandidacySource.APPLICATION);
    }

    /**
     * Propose a member who must consent before counting as a candidate.
     */
    public Nomination second(Actor actor, String cycleId, CandidacySubmission submission) {
        return submit(actor, cycleId, submission, CandidacySource.SECONDMENT);
    }

    /**
     * Nominee accepts or declines a secondment.
     */
    public Nomination respondToSecondment(Actor actor, String nominationId, boolean accept) {
        Nomination existing = requireNomination(nominationId);
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, status -> !status.isRosterFrozen() && status.ordinal() >= CycleStatus.NOMINATIONS_OPEN.ordinal(),
                    "Secondment response");
            if (!actor.id().equals(existing.getNomineeId())) {
                throw new AuthorizationException("Only the proposed member may respond to a secondment", cycle.getStatus());
            }
            Nomination updated = nominationRepository.upsert(existing.getPositionId(), existing.getNomineeId(), current -> {
                if (current.getSource() != CandidacySource.SECONDMENT || current.getConsentStatus() != ConsentStatus.PENDING) {
                    throw new ConflictException("Candidacy " + nominationId + " has no pending secondment", cycle.getStatus());
                }
                return copy(current)
                        .consentStatus(accept ? ConsentStatus.ACCEPTED : ConsentStatus.DECLINED)
                        .updatedAt(clock.instant())
                        .build();
            });
            auditService.record(cycle.getId(), actor, accept ? "secondment.accept" : "secondment.decline",
                    "Nomination", nominationId, "Secondment " + (accept ? "accepted" : "declined"),
                    existing, updated);
            structuredLogger.logCandidacyEvent(cycle.getId(), existing.getPositionId(), actor.id(),
                    accept ? CandidacyEventType.CONSENTED : CandidacyEventType.DECLINED,
                    "Secondment response recorded", Map.of("nominationId", nominationId));
            return updated;
        });
    }

    /**
     * Withdraw a candidacy. Allowed for the nominee, the original nominator and admins.
     */
    public Nomination withdraw(Actor actor, String nominationId, String reason) {
        Nomination existing = requireNomination(nominationId);
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, status -> status.ordinal() < CycleStatus.APPROVAL_PENDING.ordinal(), "Withdrawal");
            if (!actor.isAdmin() && !actor.id().equals(existing.getNomineeId()) && !actor.id().equals(existing.getNominatorId())) {
                throw new AuthorizationException("Only the nominee, the nominator or an admin may withdraw a candidacy",
                        cycle.getStatus());
            }
            ChapterPolicy policy = policyResolver.forCycle(cycle);
            if (reason == null || reason.trim().length() < policy.withdrawalReasonMinLength()) {
                throw new ValidationException(Map.of("reason",
                        "must be at least " + policy.withdrawalReasonMinLength() + " characters"), cycle.getStatus());
            }
            Nomination updated = nominationRepository.upsert(existing.getPositionId(), existing.getNomineeId(), current -> {
                if (current.getStatus() != CandidacyStatus.SUBMITTED) {
                    throw new ConflictException("Candidacy " + nominationId + " is " + current.getStatus(), cycle.getStatus());
                }
                return copy(current)
                        .status(CandidacyStatus.WITHDRAWN)
                        .withdrawalReason(reason.trim())
                        .updatedAt(clock.instant())
                        .build();
            });
            auditService.record(cycle.getId(), actor, "candidacy.withdraw", "Nomination", nominationId,
                    "Withdrawn: " + reason.trim(), existing, updated);
            structuredLogger.logCandidacyEvent(cycle.getId(), existing.getPositionId(), actor.id(),
                    CandidacyEventType.WITHDRAWN, "Candidacy withdrawn", Map.of("nominationId", nominationId));
            return updated;
        });
    }

    /**
     * Admin disqualification, typically following an eligibility recommendation.
     */
    public Nomination disqualify(Actor actor, String nominationId, String reason) {
        CycleLookup.requireAdmin(actor, "disqualify a candidacy");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required");
        }
        Nomination existing = requireNomination(nominationId);
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, status -> status.ordinal() < CycleStatus.APPROVAL_PENDING.ordinal(), "Disqualification");
            Nomination updated = nominationRepository.upsert(existing.getPositionId(), existing.getNomineeId(), current -> {
                if (current.getStatus() == CandidacyStatus.DISQUALIFIED) {
                    throw new ConflictException("Candidacy " + nominationId + " is already disqualified", cycle.getStatus());
                }
                return copy(current)
                        .status(CandidacyStatus.DISQUALIFIED)
                        .disqualificationReason(reason.trim())
                        .updatedAt(clock.instant())
                        .build();
            });
            auditService.record(cycle.getId(), actor, "candidacy.disqualify", "Nomination", nominationId,
                    "Disqualified: " + reason.trim(), existing, updated);
            structuredLogger.logCandidacyEvent(cycle.getId(), existing.getPositionId(), actor.id(),
                    CandidacyEventType.DISQUALIFIED, "Candidacy disqualified",
                    Map.of("nominationId", nominationId, "reason", reason.trim()));
            return updated;
        });
    }

    public Nomination requireNomination(String nominationId) {
        return nominationRepository.findById(nominationId)
                .orElseThrow(() -> new NotFoundException("Nomination", nominationId));
    }

    public List<Nomination> listByCycle(String cycleId) {
        cycleLookup.requireCycle(cycleId);
        return nominationRepository.findByCycleId(cycleId);
    }

    /**
     * Candidacies that are on the ballot for a position.
     */
    public List<Nomination> activeCandidates(String positionId) {
        List<Nomination> active = new ArrayList<>();
        for (Nomination nomination : nominationRepository.findByPositionId(positionId)) {
            if (nomination.isActiveCandidate()) {
                active.add(nomination);
            }
        }
        return active;
    }

    /**
     * Candidates that would be frozen into the roster now: active candidacies whose nominee is
     * eligible, per position, in submission order.
     */
    public Map<String, List<String>> eligibleRoster(List<Position> positions) {
        Map<String, List<String>> roster = new LinkedHashMap<>();
        for (Position position : positions) {
            List<String> candidates = new ArrayList<>();
            for (Nomination nomination : activeCandidates(position.getId())) {
                boolean eligible = eligibilityService.findRecord(position.getId(), nomination.getNomineeId())
                        .map(EligibilityRecord::isEligible)
                        .orElse(false);
                if (eligible) {
                    candidates.add(nomination.getNomineeId());
                }
            }
            roster.put(position.getId(), candidates);
        }
        return roster;
    }

    private Nomination submit(Actor actor, String cycleId, CandidacySubmission submission, CandidacySource source) {
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            Predicate<CycleStatus> stageAccepts = source == CandidacySource.APPLICATION
                    ? CycleStatus::acceptsApplications
                    : CycleStatus::acceptsNominations;
            cycleLookup.requireStage(cycle, stageAccepts, label(source));
            ChapterPolicy policy = policyResolver.forCycle(cycle);
            validate(actor, submission, source, policy, cycle.getStatus());
            Position position = cycleLookup.requireActivePosition(cycle, submission.getPositionId());

            String nomineeId = submission.getNomineeId();
            Optional<EligibilityRecord> eligibility = eligibilityService.findRecord(position.getId(), nomineeId);
            if (eligibility.isPresent() && eligibility.get().getStatus() == EligibilityRecord.EligibilityStatus.INELIGIBLE) {
                throw new ValidationException(Map.of("nomineeId",
                        "not eligible for " + position.getTitle() + ": " + String.join("; ", eligibility.get().getReasons())),
                        cycle.getStatus());
            }
            boolean eligibilityPending = eligibility.isEmpty() || !eligibility.get().isEligible();

            Instant now = clock.instant();
            Nomination[] before = new Nomination[1];
            Nomination stored = nominationRepository.upsert(position.getId(), nomineeId, current -> {
                before[0] = current;
                if (current == null) {
                    return fresh(cycle, position, actor, submission, source, eligibilityPending, now, null);
                }
                if (current.getStatus() == CandidacyStatus.DISQUALIFIED) {
                    throw new ConflictException("Candidacy of " + nomineeId + " for " + position.getTitle()
                            + " was disqualified", cycle.getStatus());
                }
                if (current.getStatus() == CandidacyStatus.WITHDRAWN) {
                    return fresh(cycle, position, actor, submission, source, eligibilityPending, now, current);
                }
                if (current.getSource() == CandidacySource.SECONDMENT && current.getConsentStatus() == ConsentStatus.DECLINED
                        && source != CandidacySource.APPLICATION) {
                    throw new ConflictException(nomineeId + " declined to stand for " + position.getTitle()
                            + "; only their own application can reopen the candidacy", cycle.getStatus());
                }
                return merge(current, actor, submission, source, now);
            });

            boolean created = before[0] == null || before[0].getStatus() != CandidacyStatus.SUBMITTED;
            auditService.record(cycle.getId(), actor, created ? "candidacy.submit" : "candidacy.merge",
                    "Nomination", stored.getId(),
                    label(source) + " for " + position.getTitle() + (created ? "" : " merged into existing candidacy"),
                    before[0], stored);
            metrics.recordCandidacy(source.name());
            structuredLogger.logCandidacyEvent(cycle.getId(), position.getId(), actor.id(),
                    created ? CandidacyEventType.SUBMITTED : CandidacyEventType.MERGED,
                    label(source) + (created ? " submitted" : " merged"),
                    Map.of("nominationId", stored.getId(), "source", source.name(), "eligibilityPending", eligibilityPending));

            if (created && source != CandidacySource.APPLICATION) {
                notificationDispatcher.dispatch(NotificationRequest.of(nomineeId,
                        source == CandidacySource.SECONDMENT ? NotificationTemplate.SECONDMENT_PROPOSED : NotificationTemplate.YOU_WERE_NOMINATED,
                        Map.of("cycleId", cycle.getId(), "positionId", position.getId(),
                                "positionTitle", position.getTitle(), "nominationId", stored.getId())));
            }
            return stored;
        });
    }

    private void validate(Actor actor, CandidacySubmission submission, CandidacySource source,
                          ChapterPolicy policy, CycleStatus stage) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (submission.getPositionId() == null || submission.getPositionId().isBlank()) {
            errors.put("positionId", "is required");
        }
        if (submission.getNomineeId() == null || submission.getNomineeId().isBlank()) {
            errors.put("nomineeId", "is required");
        } else if (source != CandidacySource.APPLICATION && submission.getNomineeId().equals(actor.id())) {
            errors.put("nomineeId", "members cannot nominate themselves; submit an application instead");
        }
        String justification = submission.getJustification() == null ? "" : submission.getJustification().trim();
        if (justification.length() < policy.justificationMinLength()
                || justification.length() > policy.justificationMaxLength()) {
            errors.put("justification", "must be between " + policy.justificationMinLength() + " and "
                    + policy.justificationMaxLength() + " characters");
        }
        List<EvidenceItem> evidence = submission.getEvidence() == null ? List.of() : submission.getEvidence();
        for (int i = 0; i < evidence.size(); i++) {
            EvidenceItem item = evidence.get(i);
            if (item == null || item.getType() == null || item.getType().isBlank()
                    || item.getTitle() == null || item.getTitle().isBlank()) {
                errors.put("evidence[" + i + "]", "type and title are required");
            }
        }
        ValidationException.throwIfAny(errors, stage);
    }

    private Nomination fresh(SuccessionCycle cycle, Position position, Actor actor, CandidacySubmission submission,
                             CandidacySource source, boolean eligibilityPending, Instant now, Nomination withdrawn) {
        return Nomination.builder()
                .id(withdrawn != null ? withdrawn.getId() : UUID.randomUUID().toString())
                .cycleId(cycle.getId())
                .positionId(position.getId())
                .source(source)
                .nominatorId(actor.id())
                .nomineeId(submission.getNomineeId())
                .justification(submission.getJustification().trim())
                .supportingEvidence(mergeEvidence(List.of(), submission.getEvidence()))
                .status(CandidacyStatus.SUBMITTED)
                .consentStatus(source == CandidacySource.SECONDMENT ? ConsentStatus.PENDING : null)
                .eligibilityPending(eligibilityPending)
                .submittedAt(now)
                .updatedAt(now)
                .build();
    }

    private Nomination merge(Nomination current, Actor actor, CandidacySubmission submission,
                             CandidacySource source, Instant now) {
        Nomination.NominationBuilder merged = copy(current)
                .supportingEvidence(mergeEvidence(current.getSupportingEvidence(), submission.getEvidence()))
                .updatedAt(now);
        Set<String> coNominators = new LinkedHashSet<>(current.getCoNominatorIds());
        if (!actor.id().equals(current.getNomineeId()) && !current.allNominatorIds().contains(actor.id())) {
            coNominators.add(actor.id());
        }
        merged.coNominatorIds(coNominators);
        // The nominee applying for a proposed secondment is taken as consent, even after declining
        if (source == CandidacySource.APPLICATION && current.getSource() == CandidacySource.SECONDMENT
                && current.getConsentStatus() != ConsentStatus.ACCEPTED) {
            merged.consentStatus(ConsentStatus.ACCEPTED);
        }
        return merged.build();
    }

    static List<EvidenceItem> mergeEvidence(List<EvidenceItem> existing, List<EvidenceItem> added) {
        LinkedHashSet<EvidenceItem> merged = new LinkedHashSet<>(existing);
        if (added != null) {
            merged.addAll(added);
        }
        return new ArrayList<>(merged);
    }

    private static Nomination.NominationBuilder copy(Nomination nomination) {
        return nomination.toBuilder()
                .coNominatorIds(new LinkedHashSet<>(nomination.getCoNominatorIds()))
                .supportingEvidence(new ArrayList<>(nomination.getSupportingEvidence()));
    }

    private static String label(CandidacySource source) {
        return switch (source) {
            case NOMINATION -> "Nomination";
            case APPLICATION -> "Application";
            case SECONDMENT -> "Secondment";
        };
    }
}
