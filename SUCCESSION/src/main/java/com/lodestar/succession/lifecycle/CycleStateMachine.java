package com.lodestar.succession.lifecycle;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.automation.AutomationStatusTracker;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.StateTransitionException;
import com.lodestar.succession.domain.error.SuccessionException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.CycleRepository;
import com.lodestar.succession.domain.repository.PositionRepository;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.nomination.NominationService;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.observability.SuccessionStructuredLogger;
import com.lodestar.succession.observability.SuccessionStructuredLogger.TransitionEventType;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Moves cycles along the {@link TransitionTable}.
 * <p>
 * A transition runs under the cycle's write lock and is all-or-nothing: the expected version is
 * checked, every guard is evaluated, every side effect is prepared, and only then are the
 * effects applied to a working copy that is committed with a single save. Notifications queued
 * by the effects go out after the commit.
 */
@Slf4j
@Service
public class CycleStateMachine {

    public static final String GUARD_TRANSITION_TABLE = "transition-table";
    public static final String GUARD_VERSION = "version";
    public static final String GUARD_REVERT = "revert-history";

    private final CycleRepository cycleRepository;
    private final PositionRepository positionRepository;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final TransitionTable transitionTable;
    private final NominationService nominationService;
    private final ChapterPolicyResolver policyResolver;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final SuccessionMetrics metrics;
    private final SuccessionStructuredLogger structuredLogger;
    private final AutomationStatusTracker automationTracker;
    private final Clock clock;

    public CycleStateMachine(CycleRepository cycleRepository,
                             PositionRepository positionRepository,
                             CycleLookup cycleLookup,
                             CycleLockRegistry locks,
                             TransitionTable transitionTable,
                             NominationService nominationService,
                             ChapterPolicyResolver policyResolver,
                             AuditService auditService,
                             NotificationDispatcher notificationDispatcher,
                             SuccessionMetrics metrics,
                             SuccessionStructuredLogger structuredLogger,
                             AutomationStatusTracker automationTracker,
                             Clock clock) {
        this.cycleRepository = cycleRepository;
        this.positionRepository = positionRepository;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.transitionTable = transitionTable;
        this.nominationService = nominationService;
        this.policyResolver = policyResolver;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.automationTracker = automationTracker;
        this.clock = clock;
    }

    /**
     * Move the cycle to {@code target}, which must be the next status on its forward path.
     *
     * @param expectedVersion version the caller last saw, or {@code null} to skip the check
     */
    public SuccessionCycle transition(Actor actor, String cycleId, CycleStatus target, Long expectedVersion) {
        return execute(actor, cycleId, target, expectedVersion, null);
    }

    /**
     * Like {@link #transition} but bypasses overridable guards. Non-overridable guards still apply.
     */
    public SuccessionCycle forceTransition(Actor actor, String cycleId, CycleStatus target, Long expectedVersion,
                                           String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required to force a transition");
        }
        return execute(actor, cycleId, target, expectedVersion, reason.trim());
    }

    /**
     * Transition to whatever comes next on the cycle's forward path.
     */
    public SuccessionCycle advance(Actor actor, String cycleId, Long expectedVersion) {
        SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
        CycleStatus target = TransitionTable.forwardTarget(cycle.getStatus(), cycle.isApplicationsPhaseEnabled())
                .orElseThrow(() -> new StateTransitionException(cycle.getStatus(), null, GUARD_TRANSITION_TABLE,
                        "cycle is in a final status"));
        return transition(actor, cycleId, target, expectedVersion);
    }

    /**
     * Return to the status the cycle was in before its last forward move.
     */
    public SuccessionCycle revert(Actor actor, String cycleId, Long expectedVersion, String reason) {
        CycleLookup.requireAdmin(actor, "revert a cycle");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "is required to revert a cycle");
        }
        return locks.withWriteLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            checkVersion(cycle, expectedVersion);
            CycleStatus from = cycle.getStatus();
            if (from == CycleStatus.DRAFT || from.isTerminal()) {
                throw new StateTransitionException(from, null, GUARD_REVERT, "a " + from + " cycle cannot be reverted");
            }
            CycleStatus to = cycle.previousStatus()
                    .orElseThrow(() -> new StateTransitionException(from, null, GUARD_REVERT, "no earlier status recorded"));

            Instant now = clock.instant();
            SuccessionCycle working = cycle.copy();
            if (to.ordinal() < CycleStatus.EVALUATIONS.ordinal()) {
                working.getRosterSnapshot().clear();
            }
            if (from == CycleStatus.COMPLETED) {
                working.setPublished(false);
                working.setPublishedAt(null);
            }
            commit(working, to, actor, now, false, true, reason.trim());
            automationTracker.clearWarnings(cycleId, EnumSet.of(from, to));

            auditService.record(cycleId, actor, "cycle.revert", "Cycle", cycleId,
                    from + " -> " + to + ": " + reason.trim(), statusSnapshot(cycle), statusSnapshot(working));
            metrics.recordRevert();
            structuredLogger.logTransitionEvent(cycleId, actor.id(), TransitionEventType.REVERTED, from, to,
                    "Cycle reverted", Map.of("reason", reason.trim()));
            return working;
        });
    }

    private SuccessionCycle execute(Actor actor, String cycleId, CycleStatus target, Long expectedVersion,
                                    String overrideReason) {
        CycleLookup.requireAdmin(actor, "transition a cycle");
        boolean force = overrideReason != null;
        return locks.withWriteLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            checkVersion(cycle, expectedVersion);
            CycleStatus from = cycle.getStatus();
            if (!TransitionTable.isForwardEdge(from, target, cycle.isApplicationsPhaseEnabled())) {
                throw blocked(cycle, actor, target, GUARD_TRANSITION_TABLE, "no edge " + from + " -> " + target);
            }

            Instant now = clock.instant();
            SuccessionCycle working = cycle.copy();
            List<Position> activePositions = positionRepository.findByCycleId(cycleId).stream()
                    .filter(Position::isActive)
                    .collect(Collectors.toList());
            TransitionContext context = new TransitionContext(working, target, actor,
                    policyResolver.forCycle(cycle), now, activePositions, nominationService::eligibleRoster);

            List<String> bypassed = new ArrayList<>();
            for (TransitionGuard guard : transitionTable.guardsFor(target)) {
                GuardResult result = guard.check(context);
                if (result.passed()) {
                    continue;
                }
                if (force && guard.overridable()) {
                    bypassed.add(guard.name() + ": " + result.detail());
                    continue;
                }
                throw blocked(cycle, actor, target, guard.name(), result.detail());
            }

            List<TransitionEffect.PreparedEffect> prepared = new ArrayList<>();
            for (TransitionEffect effect : transitionTable.effectsFor(target)) {
                try {
                    prepared.add(effect.prepare(context));
                } catch (RuntimeException e) {
                    metrics.recordTransitionFailed(effect.name());
                    structuredLogger.logTransitionEvent(cycleId, actor.id(), TransitionEventType.FAILED, from, target,
                            "Transition side effect failed", Map.of("effect", effect.name(), "error", String.valueOf(e.getMessage())));
                    throw new StateTransitionException(from, target, effect.name(), String.valueOf(e.getMessage()), e);
                }
            }
            prepared.forEach(TransitionEffect.PreparedEffect::apply);

            commit(working, target, actor, now, force, false, overrideReason);

            if (force) {
                auditService.record(cycleId, actor, "cycle.override", "Cycle", cycleId,
                        from + " -> " + target + " forced: " + overrideReason
                                + (bypassed.isEmpty() ? "" : " (bypassed " + bypassed + ")"),
                        statusSnapshot(cycle), statusSnapshot(working));
                metrics.recordOverride();
                structuredLogger.logTransitionEvent(cycleId, actor.id(), TransitionEventType.OVERRIDDEN, from, target,
                        "Cycle transition forced", Map.of("reason", overrideReason, "bypassed", bypassed));
            } else {
                auditService.record(cycleId, actor, "cycle.transition", "Cycle", cycleId,
                        from + " -> " + target, statusSnapshot(cycle), statusSnapshot(working));
                structuredLogger.logTransitionEvent(cycleId, actor.id(), TransitionEventType.COMPLETED, from, target,
                        "Cycle transitioned", Map.of("version", working.getVersion()));
            }
            metrics.recordTransition(from, target);
            dispatch(context.getOutbox());
            return working;
        });
    }

    private void commit(SuccessionCycle working, CycleStatus to, Actor actor, Instant now,
                        boolean override, boolean revert, String reason) {
        working.getStatusHistory().add(SuccessionCycle.StatusChange.builder()
                .from(working.getStatus())
                .to(to)
                .actorId(actor.id())
                .at(now)
                .override(override)
                .revert(revert)
                .reason(reason)
                .build());
        working.setStatus(to);
        working.setVersion(working.getVersion() + 1);
        working.setUpdatedAt(now);
        cycleRepository.save(working);
    }

    private StateTransitionException blocked(SuccessionCycle cycle, Actor actor, CycleStatus target,
                                             String guard, String detail) {
        metrics.recordTransitionFailed(guard);
        structuredLogger.logTransitionEvent(cycle.getId(), actor.id(), TransitionEventType.BLOCKED,
                cycle.getStatus(), target, "Cycle transition blocked", Map.of("guard", guard, "detail", detail));
        return new StateTransitionException(cycle.getStatus(), target, guard, detail);
    }

    private static void checkVersion(SuccessionCycle cycle, Long expectedVersion) {
        if (expectedVersion != null && expectedVersion != cycle.getVersion()) {
            throw new ConflictException("Cycle " + cycle.getId() + " is at version " + cycle.getVersion()
                    + ", not " + expectedVersion, cycle.getStatus(), GUARD_VERSION);
        }
    }

    private void dispatch(List<NotificationRequest> outbox) {
        for (NotificationRequest request : outbox) {
            try {
                notificationDispatcher.dispatch(request);
            } catch (SuccessionException | IllegalStateException e) {
                log.warn("Notification {} to {} not dispatched: {}", request.templateKey(), request.recipientId(), e.getMessage());
            }
        }
    }

    private static Map<String, Object> statusSnapshot(SuccessionCycle cycle) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", cycle.getStatus().name());
        snapshot.put("version", cycle.getVersion());
        snapshot.put("published", cycle.isPublished());
        return snapshot;
    }
}
