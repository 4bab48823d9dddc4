package com.lodestar.succession.eligibility;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.model.*;
import com.lodestar.succession.domain.repository.EligibilityRecordRepository;
import com.lodestar.succession.domain.repository.NominationRepository;
import com.lodestar.succession.domain.repository.PositionRepository;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.policy.ChapterPolicy;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Recomputes and serves eligibility records.
 * <p>
 * Recompute fetches each chapter member's activity once, in parallel, and evaluates it against
 * every active position of the cycle. A record whose input fingerprint is unchanged is kept as
 * stored. A member whose data cannot be fetched gets a {@code PENDING} record, never
 * {@code INELIGIBLE}. Candidacies are never modified here; nominees who are no longer eligible
 * are reported as disqualification recommendations.
 */
@Slf4j
@Service
public class EligibilityService {

    private final EligibilityEngine engine;
    private final MemberActivitySource activitySource;
    private final EligibilityRecordRepository recordRepository;
    private final PositionRepository positionRepository;
    private final NominationRepository nominationRepository;
    private final CycleLookup cycleLookup;
    private final ChapterPolicyResolver policyResolver;
    private final AuditService auditService;
    private final NotificationDispatcher notificationDispatcher;
    private final SuccessionMetrics metrics;
    private final SuccessionProperties properties;
    private final Clock clock;

    public EligibilityService(EligibilityEngine engine,
                              MemberActivitySource activitySource,
                              EligibilityRecordRepository recordRepository,
                              PositionRepository positionRepository,
                              NominationRepository nominationRepository,
                              CycleLookup cycleLookup,
                              ChapterPolicyResolver policyResolver,
                              AuditService auditService,
                              NotificationDispatcher notificationDispatcher,
                              SuccessionMetrics metrics,
                              SuccessionProperties properties,
                              Clock clock) {
        this.engine = engine;
        this.activitySource = activitySource;
        this.recordRepository = recordRepository;
        this.positionRepository = positionRepository;
        this.nominationRepository = nominationRepository;
        this.cycleLookup = cycleLookup;
        this.policyResolver = policyResolver;
        this.auditService = auditService;
        this.notificationDispatcher = notificationDispatcher;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Admin-triggered recompute. Newly eligible members are notified while the cycle accepts
     * candidacies.
     */
    public Mono<RecomputeReport> recompute(String cycleId, Actor actor) {
        CycleLookup.requireAdmin(actor, "recompute eligibility");
        SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
        return recompute(cycle, actor)
                .doOnNext(report -> {
                    if (cycle.getStatus().acceptsApplications()) {
                        notifyNewlyEligible(cycle, report);
                    }
                    notifyRecommendations(cycle, report);
                });
    }

    /**
     * Recompute all records of the cycle's active positions over the chapter's members.
     */
    public Mono<RecomputeReport> recompute(SuccessionCycle cycle, Actor actor) {
        List<Position> positions = positionRepository.findByCycleId(cycle.getId()).stream()
                .filter(Position::isActive)
                .collect(Collectors.toList());
        ChapterPolicy policy = policyResolver.forCycle(cycle);
        Timer.Sample sample = metrics.startRecomputeTimer();
        int parallelism = properties.getEligibility().getParallelism();

        return activitySource.chapterMemberIds(cycle.getChapterId())
                .distinct()
                .flatMap(memberId -> evaluateMember(memberId, positions, policy), parallelism)
                .flatMapIterable(outcomes -> outcomes)
                .collectList()
                .map(outcomes -> buildReport(cycle, positions, outcomes))
                .doOnNext(report -> {
                    metrics.recordRecompute(sample);
                    auditService.record(cycle.getId(), actor, "eligibility.recompute", "Cycle", cycle.getId(),
                            String.format("evaluated=%d changed=%d pending=%d newlyEligible=%d recommendations=%d",
                                    report.getEvaluated(), report.getChanged(), report.getPending(),
                                    report.getNewlyEligible().size(), report.getRecommendations().size()),
                            null, null);
                    log.info("Eligibility recomputed for cycle {}: evaluated={}, changed={}, pending={}, newlyEligible={}",
                            cycle.getId(), report.getEvaluated(), report.getChanged(), report.getPending(),
                            report.getNewlyEligible().size());
                    report.getRecommendations().forEach(recommendation ->
                            log.warn("Nominee {} of position {} is no longer eligible; disqualification recommended: {}",
                                    recommendation.nomineeId(), recommendation.positionId(), recommendation.reasons()));
                });
    }

    public Optional<EligibilityRecord> findRecord(String positionId, String memberId) {
        return recordRepository.find(positionId, memberId);
    }

    public List<EligibilityRecord> listRecords(String positionId) {
        return recordRepository.findByPositionId(positionId);
    }

    /**
     * Members currently eligible for at least one of the given positions.
     */
    public Set<String> eligibleMembers(Collection<Position> positions) {
        Set<String> members = new TreeSet<>();
        for (Position position : positions) {
            recordRepository.findByPositionId(position.getId()).stream()
                    .filter(EligibilityRecord::isEligible)
                    .map(EligibilityRecord::getMemberId)
                    .forEach(members::add);
        }
        return members;
    }

    public void notifyNewlyEligible(SuccessionCycle cycle, RecomputeReport report) {
        for (RecomputeReport.MemberPosition delta : report.getNewlyEligible()) {
            notificationDispatcher.dispatch(NotificationRequest.of(
                    delta.memberId(), NotificationTemplate.YOU_ARE_ELIGIBLE,
                    Map.of("cycleId", cycle.getId(), "cycleName", cycle.getName(), "positionId", delta.positionId())));
        }
    }

    /**
     * Eligibility loss never disqualifies on its own; admins are told and decide.
     */
    public void notifyRecommendations(SuccessionCycle cycle, RecomputeReport report) {
        for (RecomputeReport.DisqualificationRecommendation recommendation : report.getRecommendations()) {
            notificationDispatcher.dispatchAll(properties.getNotifications().getAdminRecipients(),
                    NotificationTemplate.DISQUALIFICATION_RECOMMENDED,
                    Map.of("cycleId", cycle.getId(),
                            "nominationId", recommendation.nominationId(),
                            "positionId", recommendation.positionId(),
                            "nomineeId", recommendation.nomineeId(),
                            "reasons", String.join("; ", recommendation.reasons())));
        }
    }

    private Mono<List<Outcome>> evaluateMember(String memberId, List<Position> positions, ChapterPolicy policy) {
        return activitySource.fetchActivity(memberId)
                .timeout(properties.getEligibility().getSourceTimeout())
                .map(activity -> positions.stream()
                        .map(position -> store(engine.evaluate(position, activity, policy, clock.instant())))
                        .collect(Collectors.toList()))
                .onErrorResume(e -> {
                    log.warn("Eligibility data unavailable for member {}: {}", memberId, e.getMessage());
                    return Mono.just(positions.stream()
                            .map(position -> store(engine.pending(position.getId(), memberId,
                                    String.valueOf(e.getMessage()), clock.instant())))
                            .collect(Collectors.toList()));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> positions.stream()
                        .map(position -> store(engine.pending(position.getId(), memberId, "no data", clock.instant())))
                        .collect(Collectors.toList())));
    }

    private Outcome store(EligibilityRecord computed) {
        Optional<EligibilityRecord> previous = recordRepository.find(computed.getPositionId(), computed.getMemberId());
        boolean unchanged = previous
                .filter(stored -> stored.getStatus() == computed.getStatus())
                .filter(stored -> Objects.equals(stored.getInputFingerprint(), computed.getInputFingerprint()))
                .isPresent();
        if (computed.getStatus() == EligibilityRecord.EligibilityStatus.PENDING) {
            metrics.recordEligibilityPending();
        }
        if (unchanged) {
            return new Outcome(previous.get(), false, false);
        }
        boolean wasEligible = previous.map(EligibilityRecord::isEligible).orElse(false);
        recordRepository.save(computed);
        return new Outcome(computed, true, computed.isEligible() && !wasEligible);
    }

    private RecomputeReport buildReport(SuccessionCycle cycle, List<Position> positions, List<Outcome> outcomes) {
        RecomputeReport report = RecomputeReport.builder()
                .cycleId(cycle.getId())
                .evaluated(outcomes.size())
                .changed((int) outcomes.stream().filter(Outcome::changed).count())
                .pending((int) outcomes.stream()
                        .filter(outcome -> outcome.record().getStatus() == EligibilityRecord.EligibilityStatus.PENDING)
                        .count())
                .computedAt(clock.instant())
                .build();
        outcomes.stream()
                .filter(Outcome::newlyEligible)
                .map(outcome -> new RecomputeReport.MemberPosition(outcome.record().getPositionId(), outcome.record().getMemberId()))
                .sorted(Comparator.comparing(RecomputeReport.MemberPosition::positionId)
                        .thenComparing(RecomputeReport.MemberPosition::memberId))
                .forEach(report.getNewlyEligible()::add);

        for (Position position : positions) {
            for (Nomination nomination : nominationRepository.findByPositionId(position.getId())) {
                if (nomination.getStatus() != Nomination.CandidacyStatus.SUBMITTED) {
                    continue;
                }
                recordRepository.find(position.getId(), nomination.getNomineeId())
                        .filter(record -> record.getStatus() == EligibilityRecord.EligibilityStatus.INELIGIBLE)
                        .ifPresent(record -> report.getRecommendations().add(
                                new RecomputeReport.DisqualificationRecommendation(nomination.getId(),
                                        position.getId(), nomination.getNomineeId(), List.copyOf(record.getReasons()))));
            }
        }
        return report;
    }

    private record Outcome(EligibilityRecord record, boolean changed, boolean newlyEligible) {
    }
}
