package com.lodestar.succession.timeline;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.model.TimelineStep;
import com.lodestar.succession.domain.model.TimelineStep.StepStatus;
import com.lodestar.succession.domain.repository.TimelineRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The published week-by-week timeline of a cycle.
 * <p>
 * Seeding lays out the standard seven one-week steps from a start date. The automation tick
 * refreshes statuses by date: a pending step whose window has opened becomes active and an
 * unfinished step past its end date becomes overdue.
 */
@Slf4j
@Service
public class TimelineService {

    public static final int MIN_STEP = 1;
    public static final int MAX_STEP = 7;
    static final int STEP_DAYS = 7;
    static final int MAX_NAME = 200;
    static final int MAX_DESCRIPTION = 500;
    static final int MAX_ACTION = 200;

    private static final List<StandardStep> STANDARD_STEPS = List.of(
            new StandardStep("Nominations Open", "Members can nominate candidates for leadership positions", "open_nominations"),
            new StandardStep("Self Applications", "Members can self-apply for eligible positions", "open_applications"),
            new StandardStep("Evaluation & Scoring", "Evaluators score nominees based on criteria", "start_evaluations"),
            new StandardStep("Regional Chair Review", "Regional chair reviews top candidates and provides feedback", "notify_rc"),
            new StandardStep("Steering Committee Meeting", "Committee meets to vote on final candidates", "schedule_meeting"),
            new StandardStep("Candidate Approach", "Selected candidates are approached for acceptance", "approach_candidates"),
            new StandardStep("Final Selection & Announcement", "Final selections confirmed and announced", "announce_results"));

    private final TimelineRepository timelineRepository;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final AuditService auditService;
    private final Clock clock;

    public TimelineService(TimelineRepository timelineRepository,
                           CycleLookup cycleLookup,
                           CycleLockRegistry locks,
                           AuditService auditService,
                           Clock clock) {
        this.timelineRepository = timelineRepository;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Lay out the standard steps back to back from {@code startDate}, or from the cycle's start
     * date when none is given. Fails when the cycle already has a timeline.
     */
    public List<TimelineStep> seedTimeline(Actor actor, String cycleId, LocalDate startDate) {
        CycleLookup.requireAdmin(actor, "seed the cycle timeline");
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = requireOpenCycle(cycleId);
            LocalDate start = startDate != null ? startDate : cycle.getStartDate();
            if (start == null) {
                throw new ValidationException(Map.of("startDate", "is required when the cycle has no start date"),
                        cycle.getStatus());
            }
            if (!timelineRepository.findByCycle(cycleId).isEmpty()) {
                throw new ConflictException("Cycle " + cycleId + " already has a timeline", cycle.getStatus());
            }
            Instant now = clock.instant();
            List<TimelineStep> steps = new ArrayList<>();
            LocalDate stepStart = start;
            for (int i = 0; i < STANDARD_STEPS.size(); i++) {
                StandardStep standard = STANDARD_STEPS.get(i);
                TimelineStep step = TimelineStep.builder()
                        .id(UUID.randomUUID().toString())
                        .cycleId(cycleId)
                        .stepNumber(i + 1)
                        .stepName(standard.name())
                        .description(standard.description())
                        .startDate(stepStart)
                        .endDate(stepStart.plusDays(STEP_DAYS - 1))
                        .status(StepStatus.PENDING)
                        .autoTriggerAction(standard.action())
                        .updatedAt(now)
                        .build();
                steps.add(timelineRepository.save(step));
                stepStart = stepStart.plusDays(STEP_DAYS);
            }
            auditService.record(cycleId, actor, "timeline.seed", "Cycle", cycleId,
                    steps.size() + " steps from " + start, null, null);
            return steps;
        });
    }

    public TimelineStep createStep(Actor actor, String cycleId, TimelineStepRequest request) {
        CycleLookup.requireAdmin(actor, "edit the cycle timeline");
        return locks.withReadLock(cycleId, () -> {
            SuccessionCycle cycle = requireOpenCycle(cycleId);
            validate(request, cycle.getStatus());
            boolean taken = timelineRepository.findByCycle(cycleId).stream()
                    .anyMatch(step -> step.getStepNumber() == request.getStepNumber());
            if (taken) {
                throw new ConflictException("Step " + request.getStepNumber() + " already exists", cycle.getStatus());
            }
            TimelineStep step = TimelineStep.builder()
                    .id(UUID.randomUUID().toString())
                    .cycleId(cycleId)
                    .stepNumber(request.getStepNumber())
                    .stepName(request.getStepName().trim())
                    .description(request.getDescription())
                    .startDate(request.getStartDate())
                    .endDate(request.getEndDate())
                    .status(request.getStatus() != null ? request.getStatus() : StepStatus.PENDING)
                    .autoTriggerAction(request.getAutoTriggerAction())
                    .updatedAt(clock.instant())
                    .build();
            timelineRepository.save(step);
            auditService.record(cycleId, actor, "timeline.create", "TimelineStep", step.getId(),
                    "Step " + step.getStepNumber() + " " + step.getStepName(), null, step);
            return step;
        });
    }

    public TimelineStep updateStepStatus(Actor actor, String stepId, StepStatus status) {
        CycleLookup.requireAdmin(actor, "edit the cycle timeline");
        if (status == null) {
            throw new ValidationException("status", "is required");
        }
        TimelineStep existing = requireStep(stepId);
        return locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = requireOpenCycle(existing.getCycleId());
            TimelineStep current = requireStep(stepId);
            TimelineStep updated = current.toBuilder()
                    .status(status)
                    .updatedAt(clock.instant())
                    .build();
            timelineRepository.save(updated);
            auditService.record(cycle.getId(), actor, "timeline.status", "TimelineStep", stepId,
                    "Step " + current.getStepNumber() + ": " + current.getStatus() + " -> " + status,
                    current.getStatus(), status);
            return updated;
        });
    }

    public void deleteStep(Actor actor, String stepId) {
        CycleLookup.requireAdmin(actor, "edit the cycle timeline");
        TimelineStep existing = requireStep(stepId);
        locks.withReadLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = requireOpenCycle(existing.getCycleId());
            timelineRepository.delete(stepId);
            auditService.record(cycle.getId(), actor, "timeline.delete", "TimelineStep", stepId,
                    "Deleted step " + existing.getStepNumber(), existing, null);
            return null;
        });
    }

    /**
     * Bring step statuses in line with today's date.
     *
     * @return the steps whose status changed
     */
    public List<TimelineStep> refreshStatuses(String cycleId) {
        LocalDate today = LocalDate.now(clock);
        List<TimelineStep> changed = new ArrayList<>();
        for (TimelineStep step : timelineRepository.findByCycle(cycleId)) {
            StepStatus next = step.getStatus();
            if (step.getStatus() == StepStatus.PENDING && !today.isBefore(step.getStartDate())) {
                next = StepStatus.ACTIVE;
            }
            if ((next == StepStatus.PENDING || next == StepStatus.ACTIVE) && today.isAfter(step.getEndDate())) {
                next = StepStatus.OVERDUE;
            }
            if (next == step.getStatus()) {
                continue;
            }
            TimelineStep updated = step.toBuilder()
                    .status(next)
                    .updatedAt(clock.instant())
                    .build();
            timelineRepository.save(updated);
            changed.add(updated);
            auditService.record(cycleId, Actor.SYSTEM, "timeline.status", "TimelineStep", step.getId(),
                    "Step " + step.getStepNumber() + ": " + step.getStatus() + " -> " + next, step.getStatus(), next);
        }
        if (!changed.isEmpty()) {
            log.info("Timeline of cycle {} refreshed: {} step(s) changed", cycleId, changed.size());
        }
        return changed;
    }

    public TimelineStep requireStep(String stepId) {
        return timelineRepository.findById(stepId)
                .orElseThrow(() -> new NotFoundException("TimelineStep", stepId));
    }

    public List<TimelineStep> listSteps(String cycleId) {
        cycleLookup.requireCycle(cycleId);
        return timelineRepository.findByCycle(cycleId);
    }

    private SuccessionCycle requireOpenCycle(String cycleId) {
        SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
        cycleLookup.requireStage(cycle, status -> !status.isTerminal(), "Timeline editing");
        return cycle;
    }

    private static void validate(TimelineStepRequest request, CycleStatus stage) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request.getStepNumber() < MIN_STEP || request.getStepNumber() > MAX_STEP) {
            errors.put("stepNumber", "must be " + MIN_STEP + "-" + MAX_STEP);
        }
        if (request.getStepName() == null || request.getStepName().isBlank()) {
            errors.put("stepName", "is required");
        } else if (request.getStepName().length() > MAX_NAME) {
            errors.put("stepName", "at most " + MAX_NAME + " characters");
        }
        if (request.getDescription() != null && request.getDescription().length() > MAX_DESCRIPTION) {
            errors.put("description", "at most " + MAX_DESCRIPTION + " characters");
        }
        if (request.getAutoTriggerAction() != null && request.getAutoTriggerAction().length() > MAX_ACTION) {
            errors.put("autoTriggerAction", "at most " + MAX_ACTION + " characters");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            errors.put("startDate", "start and end dates are required");
        } else if (!request.getEndDate().isAfter(request.getStartDate())) {
            errors.put("endDate", "must be after the start date");
        }
        ValidationException.throwIfAny(errors, stage);
    }

    private record StandardStep(String name, String description, String action) {
    }
}
