package com.lodestar.succession.automation;

import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.CycleRepository;
import com.lodestar.succession.evaluation.EvaluationService;
import com.lodestar.succession.evaluation.OutstandingScore;
import com.lodestar.succession.lifecycle.CycleStateMachine;
import com.lodestar.succession.lifecycle.TransitionTable;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.observability.SuccessionStructuredLogger;
import com.lodestar.succession.observability.SuccessionStructuredLogger.AutomationEventType;
import com.lodestar.succession.timeline.TimelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deadline automation.
 * <p>
 * Every tick looks at each open cycle: a passed deadline on an automated stage triggers the
 * forward transition as the system actor, an upcoming deadline inside the warning window
 * triggers a one-off warning. Failures are counted per cycle and escalated to admins once the
 * threshold is reached. One cycle failing never stops the others. Timeline step statuses are
 * refreshed against today's date on the same pass.
 */
@Slf4j
@Component
public class AutomationScheduler {

    private final CycleRepository cycleRepository;
    private final CycleStateMachine stateMachine;
    private final EvaluationService evaluationService;
    private final TimelineService timelineService;
    private final AutomationStatusTracker tracker;
    private final NotificationDispatcher notificationDispatcher;
    private final SuccessionMetrics metrics;
    private final SuccessionStructuredLogger structuredLogger;
    private final SuccessionProperties properties;
    private final Clock clock;

    public AutomationScheduler(CycleRepository cycleRepository,
                               CycleStateMachine stateMachine,
                               EvaluationService evaluationService,
                               TimelineService timelineService,
                               AutomationStatusTracker tracker,
                               NotificationDispatcher notificationDispatcher,
                               SuccessionMetrics metrics,
                               SuccessionStructuredLogger structuredLogger,
                               SuccessionProperties properties,
                               Clock clock) {
        this.cycleRepository = cycleRepository;
        this.stateMachine = stateMachine;
        this.evaluationService = evaluationService;
        this.timelineService = timelineService;
        this.tracker = tracker;
        this.notificationDispatcher = notificationDispatcher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${succession.automation.tick-interval-ms:3600000}")
    public void scheduledTick() {
        if (!properties.getAutomation().isEnabled()) {
            return;
        }
        tick();
    }

    /**
     * One pass over all open cycles.
     */
    public void tick() {
        metrics.recordAutomationTick();
        for (SuccessionCycle cycle : cycleRepository.findOpen()) {
            try {
                process(cycle);
            } catch (RuntimeException e) {
                log.error("Automation failed unexpectedly for cycle {}", cycle.getId(), e);
            }
        }
        metrics.setEscalatedCycles(tracker.escalatedCount());
    }

    public AutomationStatus status(String cycleId) {
        return tracker.status(cycleId);
    }

    private void process(SuccessionCycle cycle) {
        timelineService.refreshStatuses(cycle.getId());
        CycleStatus stage = cycle.getStatus();
        Optional<Instant> deadline = cycle.deadlineFor(stage);
        if (deadline.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        if (now.isBefore(deadline.get())) {
            if (!now.isBefore(deadline.get().minus(properties.getAutomation().getWarningWindow()))) {
                warn(cycle, stage, deadline.get());
            }
            return;
        }
        if (!TransitionTable.isAutomated(stage)) {
            structuredLogger.logAutomationEvent(cycle.getId(), AutomationEventType.SKIPPED,
                    "Deadline passed on a manual stage", Map.of("stage", stage.name()));
            return;
        }
        Optional<CycleStatus> target = TransitionTable.forwardTarget(stage, cycle.isApplicationsPhaseEnabled());
        if (target.isEmpty()) {
            return;
        }
        advance(cycle, stage, target.get(), now);
    }

    private void advance(SuccessionCycle cycle, CycleStatus from, CycleStatus to, Instant now) {
        try {
            stateMachine.transition(Actor.SYSTEM, cycle.getId(), to, null);
            tracker.recordSuccess(cycle.getId(), now);
            structuredLogger.logAutomationEvent(cycle.getId(), AutomationEventType.ADVANCED,
                    "Cycle advanced on deadline", Map.of("from", from.name(), "to", to.name()));
        } catch (RuntimeException e) {
            int failures = tracker.recordFailure(cycle.getId(), e.getMessage(), now);
            metrics.recordAutomationFailure();
            structuredLogger.logAutomationEvent(cycle.getId(), AutomationEventType.ATTEMPT_FAILED,
                    "Automatic transition failed",
                    Map.of("from", from.name(), "to", to.name(), "failures", failures,
                            "error", String.valueOf(e.getMessage())));
            if (failures >= properties.getAutomation().getEscalationThreshold() && tracker.markEscalated(cycle.getId())) {
                escalate(cycle, from, to, failures, e);
            }
        }
    }

    private void escalate(SuccessionCycle cycle, CycleStatus from, CycleStatus to, int failures, RuntimeException cause) {
        metrics.recordEscalation();
        structuredLogger.logAutomationEvent(cycle.getId(), AutomationEventType.ESCALATED,
                "Automation escalated to admins",
                Map.of("from", from.name(), "to", to.name(), "failures", failures));
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("cycleId", cycle.getId());
        context.put("cycleName", cycle.getName());
        context.put("stage", from.name());
        context.put("failures", failures);
        context.put("error", String.valueOf(cause.getMessage()));
        notificationDispatcher.dispatchAll(properties.getNotifications().getAdminRecipients(),
                NotificationTemplate.AUTOMATION_ESCALATED, context);
    }

    private void warn(SuccessionCycle cycle, CycleStatus stage, Instant deadline) {
        if (!tracker.markWarned(cycle.getId(), stage)) {
            return;
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("cycleId", cycle.getId());
        context.put("cycleName", cycle.getName());
        context.put("stage", stage.name());
        context.put("deadline", deadline.toString());

        Set<String> recipients = new LinkedHashSet<>(cycle.getSelectionCommitteeIds());
        recipients.addAll(properties.getNotifications().getAdminRecipients());
        notificationDispatcher.dispatchAll(recipients, NotificationTemplate.PHASE_DEADLINE_WARNING, context);

        int reminders = 0;
        if (stage == CycleStatus.EVALUATIONS) {
            List<String> evaluators = evaluationService.outstandingScores(cycle).stream()
                    .map(OutstandingScore::evaluatorId)
                    .distinct()
                    .collect(Collectors.toList());
            notificationDispatcher.dispatchAll(evaluators, NotificationTemplate.SCORES_INCOMPLETE, context);
            reminders = evaluators.size();
        }
        structuredLogger.logAutomationEvent(cycle.getId(), AutomationEventType.WARNING_SENT,
                "Deadline warning sent", Map.of("stage", stage.name(), "recipients", recipients.size(),
                        "scoreReminders", reminders));
    }
}
