package com.lodestar.succession.interview;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.*;
import com.lodestar.succession.domain.model.InterviewSlot.Attendance;
import com.lodestar.succession.domain.repository.InterviewRepository;
import com.lodestar.succession.domain.repository.NominationRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.policy.ChapterPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Interview slots for rostered candidates and panel feedback.
 * <p>
 * Slots are scheduled by admins from evaluations_closed through interviews. Feedback comes
 * only from the slot's panelists, only once the slot has ended, and never for a cancelled
 * slot; a panelist's resubmission overwrites their earlier feedback.
 */
@Slf4j
@Service
public class InterviewService {

    private static final EnumSet<Attendance> PENDING = EnumSet.of(Attendance.SCHEDULED, Attendance.RESCHEDULED);

    private final InterviewRepository interviewRepository;
    private final NominationRepository nominationRepository;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public InterviewService(InterviewRepository interviewRepository,
                            NominationRepository nominationRepository,
                            CycleLookup cycleLookup,
                            CycleLockRegistry locks,
                            AuditService auditService,
                            NotificationDispatcher notificationDispatcher,
                            Clock clock) {
        this.interviewRepository = interviewRepository;
        this.nominationRepository = nominationRepository;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    public InterviewSlot schedule(Actor actor, String cycleId, SlotRequest request) {
        CycleLookup.requireAdmin(actor, "schedule interviews");
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, CycleStatus::acceptsInterviewScheduling, "Interview scheduling");
            Position position = cycleLookup.requireActivePosition(cycle, request.getPositionId());
            validateSlot(request, cycle.getStatus());
            requireRosteredCandidate(cycle, position, request.getCandidateId());

            Instant now = clock.instant();
            InterviewSlot slot = InterviewSlot.builder()
                    .id(UUID.randomUUID().toString())
                    .cycleId(cycleId)
                    .positionId(position.getId())
                    .candidateId(request.getCandidateId())
                    .scheduledAt(request.getScheduledAt())
                    .durationMinutes(request.getDurationMinutes())
                    .location(request.getLocation())
                    .meetingLink(request.getMeetingLink())
                    .panelMemberIds(new LinkedHashSet<>(request.getPanelMemberIds()))
                    .attendance(Attendance.SCHEDULED)
                    .createdBy(actor.id())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            interviewRepository.saveSlot(slot);
            auditService.record(cycleId, actor, "interview.schedule", "InterviewSlot", slot.getId(),
                    "Interview for " + slot.getCandidateId() + " at " + slot.getScheduledAt(), null, slot);
            invite(cycle, slot, NotificationTemplate.INTERVIEW_INVITATION);
            return slot;
        });
    }

    /**
     * Move a slot to a new future time. A reason is required.
     */
    public InterviewSlot reschedule(Actor actor, String slotId, Instant newTime, String reason) {
        CycleLookup.requireAdmin(actor, "reschedule interviews");
        InterviewSlot existing = requireSlot(slotId);
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, CycleStatus::acceptsInterviewScheduling, "Interview rescheduling");
            Map<String, String> errors = new LinkedHashMap<>();
            if (newTime == null || !newTime.isAfter(clock.instant())) {
                errors.put("scheduledAt", "must be in the future");
            }
            if (reason == null || reason.isBlank()) {
                errors.put("reason", "is required");
            }
            ValidationException.throwIfAny(errors, cycle.getStatus());
            InterviewSlot current = requireSlot(slotId);
            if (!PENDING.contains(current.getAttendance())) {
                throw new ConflictException("Interview " + slotId + " is " + current.getAttendance(), cycle.getStatus());
            }
            InterviewSlot updated = current.toBuilder()
                    .panelMemberIds(new LinkedHashSet<>(current.getPanelMemberIds()))
                    .scheduledAt(newTime)
                    .attendance(Attendance.RESCHEDULED)
                    .rescheduleReason(reason.trim())
                    .updatedAt(clock.instant())
                    .build();
            interviewRepository.saveSlot(updated);
            auditService.record(cycle.getId(), actor, "interview.reschedule", "InterviewSlot", slotId,
                    "Moved to " + newTime + ": " + reason.trim(), current, updated);
            invite(cycle, updated, NotificationTemplate.INTERVIEW_RESCHEDULED);
            return updated;
        });
    }

    /**
     * Record how the interview went. Cancellation is possible until the slot ends; attended and
     * no-show only once it has started.
     */
    public InterviewSlot recordAttendance(Actor actor, String slotId, Attendance attendance) {
        InterviewSlot existing = requireSlot(slotId);
        if (!actor.isAdmin() && !existing.getPanelMemberIds().contains(actor.id())) {
            throw new AuthorizationException("Only an admin or a panelist may record attendance");
        }
        if (attendance == null || PENDING.contains(attendance)) {
            throw new ValidationException("attendance", "must be ATTENDED, NO_SHOW or CANCELLED");
        }
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            cycleLookup.requireStage(cycle, CycleStatus::acceptsInterviewScheduling, "Attendance updates");
            InterviewSlot current = requireSlot(slotId);
            Instant now = clock.instant();
            if (attendance == Attendance.CANCELLED) {
                if (!PENDING.contains(current.getAttendance()) || !now.isBefore(current.endsAt())) {
                    throw new ConflictException("Interview " + slotId + " can no longer be cancelled", cycle.getStatus());
                }
            } else if (now.isBefore(current.getScheduledAt())) {
                throw new ConflictException("Interview " + slotId + " has not started yet", cycle.getStatus());
            } else if (current.getAttendance() == Attendance.CANCELLED) {
                throw new ConflictException("Interview " + slotId + " was cancelled", cycle.getStatus());
            }
            InterviewSlot updated = current.toBuilder()
                    .panelMemberIds(new LinkedHashSet<>(current.getPanelMemberIds()))
                    .attendance(attendance)
                    .updatedAt(now)
                    .build();
            interviewRepository.saveSlot(updated);
            auditService.record(cycle.getId(), actor, "interview.attendance", "InterviewSlot", slotId,
                    "Attendance " + attendance, current.getAttendance(), attendance);
            return updated;
        });
    }

    public InterviewFeedback submitFeedback(Actor actor, String slotId, FeedbackRequest request) {
        InterviewSlot slot = requireSlot(slotId);
        if (!slot.getPanelMemberIds().contains(actor.id())) {
            throw new AuthorizationException(actor.id() + " is not on the panel of interview " + slotId);
        }
        return locks.withReadLock(slot.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(slot.getCycleId());
            cycleLookup.requireStage(cycle,
                    status -> status.ordinal() >= CycleStatus.EVALUATIONS_CLOSED.ordinal()
                            && status.ordinal() <= CycleStatus.INTERVIEWS_CLOSED.ordinal(),
                    "Interview feedback");
            InterviewSlot current = requireSlot(slotId);
            if (current.getAttendance() == Attendance.CANCELLED) {
                throw new ConflictException("Interview " + slotId + " was cancelled", cycle.getStatus());
            }
            Instant now = clock.instant();
            if (now.isBefore(current.endsAt())) {
                throw new ConflictException("Feedback opens when interview " + slotId + " ends at " + current.endsAt(),
                        cycle.getStatus());
            }
            if (request.getOverallRating() < ChapterPolicy.MIN_FEEDBACK_RATING
                    || request.getOverallRating() > ChapterPolicy.MAX_FEEDBACK_RATING) {
                throw new ValidationException(Map.of("overallRating", "must be between "
                        + ChapterPolicy.MIN_FEEDBACK_RATING + " and " + ChapterPolicy.MAX_FEEDBACK_RATING), cycle.getStatus());
            }
            InterviewFeedback feedback = InterviewFeedback.builder()
                    .slotId(slotId)
                    .panelistId(actor.id())
                    .overallRating(request.getOverallRating())
                    .strengths(request.getStrengths())
                    .areasForImprovement(request.getAreasForImprovement())
                    .recommendation(request.getRecommendation())
                    .notes(request.getNotes())
                    .submittedAt(now)
                    .build();
            InterviewFeedback stored = interviewRepository.upsertFeedback(feedback);
            auditService.record(cycle.getId(), actor, "interview.feedback", "InterviewFeedback",
                    slotId + "/" + actor.id(), "Rating " + request.getOverallRating(), null, stored);
            return stored;
        });
    }

    public InterviewSlot requireSlot(String slotId) {
        return interviewRepository.findSlot(slotId)
                .orElseThrow(() -> new NotFoundException("InterviewSlot", slotId));
    }

    public List<InterviewSlot> listSlots(String cycleId) {
        return interviewRepository.findSlotsByCycle(cycleId);
    }

    public List<InterviewFeedback> listFeedback(String slotId) {
        requireSlot(slotId);
        return interviewRepository.findFeedbackBySlot(slotId);
    }

    /**
     * Scheduled or rescheduled interviews that have not ended yet, including ones in progress.
     */
    public List<InterviewSlot> futureInterviews(String cycleId, Instant now) {
        return interviewRepository.findSlotsByCycle(cycleId).stream()
                .filter(slot -> PENDING.contains(slot.getAttendance()))
                .filter(slot -> slot.endsAt().isAfter(now))
                .collect(Collectors.toList());
    }

    private void validateSlot(SlotRequest request, CycleStatus stage) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request.getCandidateId() == null || request.getCandidateId().isBlank()) {
            errors.put("candidateId", "is required");
        }
        if (request.getScheduledAt() == null || !request.getScheduledAt().isAfter(clock.instant())) {
            errors.put("scheduledAt", "must be in the future");
        }
        if (request.getDurationMinutes() < ChapterPolicy.MIN_INTERVIEW_MINUTES
                || request.getDurationMinutes() > ChapterPolicy.MAX_INTERVIEW_MINUTES) {
            errors.put("durationMinutes", "must be between " + ChapterPolicy.MIN_INTERVIEW_MINUTES
                    + " and " + ChapterPolicy.MAX_INTERVIEW_MINUTES + " minutes");
        }
        Set<String> panel = request.getPanelMemberIds() == null
                ? Set.of() : new LinkedHashSet<>(request.getPanelMemberIds());
        if (panel.isEmpty() || panel.size() > ChapterPolicy.MAX_PANEL_SIZE) {
            errors.put("panelMemberIds", "between 1 and " + ChapterPolicy.MAX_PANEL_SIZE + " panelists are required");
        } else if (panel.contains(request.getCandidateId())) {
            errors.put("panelMemberIds", "the candidate cannot sit on their own panel");
        }
        boolean hasLocation = request.getLocation() != null && !request.getLocation().isBlank();
        boolean hasLink = request.getMeetingLink() != null && !request.getMeetingLink().isBlank();
        if (!hasLocation && !hasLink) {
            errors.put("location", "a location or a meeting link is required");
        }
        ValidationException.throwIfAny(errors, stage);
    }

    private void requireRosteredCandidate(SuccessionCycle cycle, Position position, String candidateId) {
        boolean active = nominationRepository.findByPositionAndNominee(position.getId(), candidateId)
                .map(Nomination::isActiveCandidate)
                .orElse(false);
        if (!active || !cycle.frozenRoster(position.getId()).contains(candidateId)) {
            throw new ValidationException(Map.of("candidateId",
                    candidateId + " is not a rostered candidate for " + position.getTitle()), cycle.getStatus());
        }
    }

    private void invite(SuccessionCycle cycle, InterviewSlot slot, NotificationTemplate template) {
        Map<String, Object> context = new HashMap<>();
        context.put("cycleId", cycle.getId());
        context.put("slotId", slot.getId());
        context.put("scheduledAt", slot.getScheduledAt().toString());
        context.put("durationMinutes", slot.getDurationMinutes());
        if (slot.getLocation() != null) {
            context.put("location", slot.getLocation());
        }
        if (slot.getMeetingLink() != null) {
            context.put("meetingLink", slot.getMeetingLink());
        }
        List<String> recipients = new ArrayList<>();
        recipients.add(slot.getCandidateId());
        recipients.addAll(slot.getPanelMemberIds());
        notificationDispatcher.dispatchAll(recipients, template, context);
    }
}
