package com.lodestar.succession.meeting;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Meeting;
import com.lodestar.succession.domain.model.Meeting.MeetingStatus;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.MeetingRepository;
import com.lodestar.succession.domain.repository.VoteRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Committee meetings of a cycle.
 * <p>
 * Steering committee and final selection meetings are where ballots are cast: while the cycle
 * is in selection every ballot must name one of them, and only while it is scheduled or in
 * progress. A meeting can be deleted only while it is scheduled and holds no ballots.
 */
@Slf4j
@Service
public class MeetingService {

    static final int MAX_LOCATION = 200;
    static final int MAX_AGENDA = 2000;
    static final int MAX_NOTES = 5000;

    private final MeetingRepository meetingRepository;
    private final VoteRepository voteRepository;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public MeetingService(MeetingRepository meetingRepository,
                          VoteRepository voteRepository,
                          CycleLookup cycleLookup,
                          CycleLockRegistry locks,
                          AuditService auditService,
                          NotificationDispatcher notificationDispatcher,
                          Clock clock) {
        this.meetingRepository = meetingRepository;
        this.voteRepository = voteRepository;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    public Meeting createMeeting(Actor actor, String cycleId, MeetingRequest request) {
        CycleLookup.requireAdmin(actor, "schedule committee meetings");
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            cycleLookup.requireStage(cycle, MeetingService::acceptsMeetings, "Meeting scheduling");
            validate(request, cycle.getStatus());

            Instant now = clock.instant();
            Meeting meeting = Meeting.builder()
                    .id(UUID.randomUUID().toString())
                    .cycleId(cycleId)
                    .meetingType(request.getMeetingType())
                    .meetingDate(request.getMeetingDate())
                    .location(trimToNull(request.getLocation()))
                    .meetingLink(trimToNull(request.getMeetingLink()))
                    .agenda(trimToNull(request.getAgenda()))
                    .notes(trimToNull(request.getNotes()))
                    .status(MeetingStatus.SCHEDULED)
                    .createdBy(actor.id())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            meetingRepository.save(meeting);
            auditService.record(cycleId, actor, "meeting.create", "Meeting", meeting.getId(),
                    meeting.getMeetingType() + " meeting on " + meeting.getMeetingDate(), null, meeting);
            notifyCommittee(cycle, meeting, NotificationTemplate.MEETING_SCHEDULED);
            return meeting;
        });
    }

    public Meeting updateMeetingStatus(Actor actor, String meetingId, MeetingStatus status) {
        CycleLookup.requireAdmin(actor, "update committee meetings");
        if (status == null) {
            throw new ValidationException("status", "is required");
        }
        Meeting existing = requireMeeting(meetingId);
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            Meeting current = requireMeeting(meetingId);
            if (!current.getStatus().canMoveTo(status)) {
                throw new ConflictException("Meeting " + meetingId + " cannot move from " + current.getStatus()
                        + " to " + status, cycle.getStatus());
            }
            Meeting updated = current.toBuilder()
                    .status(status)
                    .updatedAt(clock.instant())
                    .build();
            meetingRepository.save(updated);
            auditService.record(cycle.getId(), actor, "meeting.status", "Meeting", meetingId,
                    current.getStatus() + " -> " + status, current.getStatus(), status);
            if (status == MeetingStatus.CANCELLED) {
                notifyCommittee(cycle, updated, NotificationTemplate.MEETING_CANCELLED);
            }
            return updated;
        });
    }

    public void deleteMeeting(Actor actor, String meetingId) {
        CycleLookup.requireAdmin(actor, "delete committee meetings");
        Meeting existing = requireMeeting(meetingId);
        locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            Meeting current = requireMeeting(meetingId);
            if (current.getStatus() != MeetingStatus.SCHEDULED) {
                throw new ConflictException("Only scheduled meetings can be deleted", cycle.getStatus());
            }
            if (voteRepository.existsByMeeting(meetingId)) {
                throw new ConflictException("Meeting " + meetingId + " already holds ballots", cycle.getStatus());
            }
            meetingRepository.delete(meetingId);
            auditService.record(cycle.getId(), actor, "meeting.delete", "Meeting", meetingId,
                    "Deleted " + current.getMeetingType() + " meeting", current, null);
            return null;
        });
    }

    public Meeting requireMeeting(String meetingId) {
        return meetingRepository.findById(meetingId)
                .orElseThrow(() -> new NotFoundException("Meeting", meetingId));
    }

    public List<Meeting> listMeetings(String cycleId) {
        cycleLookup.requireCycle(cycleId);
        return meetingRepository.findByCycle(cycleId);
    }

    private static boolean acceptsMeetings(CycleStatus status) {
        return status != CycleStatus.DRAFT && status != CycleStatus.COMPLETED && !status.isTerminal();
    }

    private void validate(MeetingRequest request, CycleStatus stage) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request.getMeetingType() == null) {
            errors.put("meetingType", "is required");
        }
        if (request.getMeetingDate() == null || !request.getMeetingDate().isAfter(clock.instant())) {
            errors.put("meetingDate", "must be in the future");
        }
        String location = trimToNull(request.getLocation());
        String link = trimToNull(request.getMeetingLink());
        if (location == null && link == null) {
            errors.put("location", "a location or a meeting link is required");
        } else if (location != null && location.length() > MAX_LOCATION) {
            errors.put("location", "at most " + MAX_LOCATION + " characters");
        }
        if (link != null && !isHttpUrl(link)) {
            errors.put("meetingLink", "must be an http(s) URL");
        }
        if (request.getAgenda() != null && request.getAgenda().length() > MAX_AGENDA) {
            errors.put("agenda", "at most " + MAX_AGENDA + " characters");
        }
        if (request.getNotes() != null && request.getNotes().length() > MAX_NOTES) {
            errors.put("notes", "at most " + MAX_NOTES + " characters");
        }
        ValidationException.throwIfAny(errors, stage);
    }

    private void notifyCommittee(SuccessionCycle cycle, Meeting meeting, NotificationTemplate template) {
        if (!meeting.getMeetingType().isVoting() || cycle.getSelectionCommitteeIds().isEmpty()) {
            return;
        }
        Map<String, Object> context = new HashMap<>();
        context.put("cycleId", cycle.getId());
        context.put("meetingId", meeting.getId());
        context.put("meetingType", meeting.getMeetingType().name());
        context.put("meetingDate", meeting.getMeetingDate().toString());
        if (meeting.getLocation() != null) {
            context.put("location", meeting.getLocation());
        }
        if (meeting.getMeetingLink() != null) {
            context.put("meetingLink", meeting.getMeetingLink());
        }
        notificationDispatcher.dispatchAll(cycle.getSelectionCommitteeIds(), template, context);
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
