package com.lodestar.succession.observability;

import com.lodestar.succession.domain.model.CycleStatus;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the SUCCESSION service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Cycle transitions (by edge, failures, overrides)</li>
 *     <li>Deadline automation (ticks, failures, escalations)</li>
 *     <li>Candidacies, scores and ballots</li>
 *     <li>Eligibility recompute latency</li>
 * </ul>
 */
@Component
public class SuccessionMetrics {

    private final MeterRegistry meterRegistry;

    // Transition metrics
    @Getter
    private final Counter transitionsFailed;
    @Getter
    private final Counter transitionOverrides;
    @Getter
    private final Counter reverts;
    private final Map<String, Counter> transitionsByEdge = new ConcurrentHashMap<>();

    // Automation metrics
    @Getter
    private final Counter automationTicks;
    @Getter
    private final Counter automationFailures;
    @Getter
    private final Counter automationEscalations;
    private final AtomicInteger escalatedCycles;

    // Intake and scoring metrics
    private final Map<String, Counter> candidaciesBySource = new ConcurrentHashMap<>();
    @Getter
    private final Counter scoresSubmitted;
    @Getter
    private final Counter ballotsCast;
    @Getter
    private final Counter selectionsRecorded;

    // Eligibility metrics
    private final Timer eligibilityRecompute;
    @Getter
    private final Counter eligibilityPending;

    public SuccessionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.transitionsFailed = Counter.builder("succession.transitions.failed")
                .description("Cycle transitions rejected by a guard or a failing side effect")
                .register(meterRegistry);
        this.transitionOverrides = Counter.builder("succession.transitions.overrides")
                .description("Transitions forced past an overridable guard")
                .register(meterRegistry);
        this.reverts = Counter.builder("succession.transitions.reverts")
                .description("Admin reverts to a previous stage")
                .register(meterRegistry);

        this.automationTicks = Counter.builder("succession.automation.ticks")
                .description("Deadline scheduler ticks")
                .register(meterRegistry);
        this.automationFailures = Counter.builder("succession.automation.failures")
                .description("Automatic transitions that failed")
                .register(meterRegistry);
        this.automationEscalations = Counter.builder("succession.automation.escalations")
                .description("Cycles escalated after repeated automation failures")
                .register(meterRegistry);
        this.escalatedCycles = meterRegistry.gauge("succession.automation.escalated", new AtomicInteger(0));

        this.scoresSubmitted = Counter.builder("succession.scores.submitted")
                .description("Evaluation scores submitted or overwritten")
                .register(meterRegistry);
        this.ballotsCast = Counter.builder("succession.ballots.cast")
                .description("Committee ballots cast or overwritten")
                .register(meterRegistry);
        this.selectionsRecorded = Counter.builder("succession.selections.recorded")
                .description("Selections confirmed by an admin")
                .register(meterRegistry);

        this.eligibilityRecompute = Timer.builder("succession.eligibility.recompute")
                .description("Eligibility recompute duration per cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.eligibilityPending = Counter.builder("succession.eligibility.pending")
                .description("Eligibility records left pending because member data was unavailable")
                .register(meterRegistry);
    }

    // ========== Transition Methods ==========

    public void recordTransition(CycleStatus from, CycleStatus to) {
        transitionsByEdge.computeIfAbsent(from + "->" + to, edge ->
                Counter.builder("succession.transitions")
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .description("Completed cycle transitions")
                        .register(meterRegistry)).increment();
    }

    public void recordTransitionFailed(String guard) {
        transitionsFailed.increment();
        Counter.builder("succession.transitions.failed.by_guard")
                .tag("guard", guard != null ? guard : "none")
                .register(meterRegistry)
                .increment();
    }

    public void recordOverride() {
        transitionOverrides.increment();
    }

    public void recordRevert() {
        reverts.increment();
    }

    // ========== Automation Methods ==========

    public void recordAutomationTick() {
        automationTicks.increment();
    }

    public void recordAutomationFailure() {
        automationFailures.increment();
    }

    public void recordEscalation() {
        automationEscalations.increment();
    }

    public void setEscalatedCycles(int count) {
        escalatedCycles.set(count);
    }

    // ========== Intake and Scoring Methods ==========

    public void recordCandidacy(String source) {
        candidaciesBySource.computeIfAbsent(source, key ->
                Counter.builder("succession.candidacies")
                        .tag("source", key)
                        .description("Candidacies submitted by provenance")
                        .register(meterRegistry)).increment();
    }

    public void recordScore() {
        scoresSubmitted.increment();
    }

    public void recordBallot() {
        ballotsCast.increment();
    }

    public void recordSelection() {
        selectionsRecorded.increment();
    }

    // ========== Eligibility Methods ==========

    public Timer.Sample startRecomputeTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRecompute(Timer.Sample sample) {
        sample.stop(eligibilityRecompute);
    }

    public void recordEligibilityPending() {
        eligibilityPending.increment();
    }
}
