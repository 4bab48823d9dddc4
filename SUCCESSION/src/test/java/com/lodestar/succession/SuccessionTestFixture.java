package com.lodestar.succession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lodestar.succession.api.mapper.RecordViewMapper;
import com.lodestar.succession.approach.ApproachService;
import com.lodestar.succession.audit.AuditExporter;
import com.lodestar.succession.audit.AuditFilter;
import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.audit.InMemoryAuditSink;
import com.lodestar.succession.automation.AutomationScheduler;
import com.lodestar.succession.automation.AutomationStatusTracker;
import com.lodestar.succession.client.WebClientMemberActivitySource;
import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.AuditLogEntry;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.EligibilityCriteria;
import com.lodestar.succession.domain.model.EvaluationCriterion;
import com.lodestar.succession.domain.model.Meeting;
import com.lodestar.succession.domain.model.Meeting.MeetingType;
import com.lodestar.succession.domain.model.MemberActivity;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.InMemoryApproachRepository;
import com.lodestar.succession.domain.repository.InMemoryCycleRepository;
import com.lodestar.succession.domain.repository.InMemoryEligibilityRecordRepository;
import com.lodestar.succession.domain.repository.InMemoryEvaluationRepository;
import com.lodestar.succession.domain.repository.InMemoryInterviewRepository;
import com.lodestar.succession.domain.repository.InMemoryMeetingRepository;
import com.lodestar.succession.domain.repository.InMemoryNominationRepository;
import com.lodestar.succession.domain.repository.InMemoryPositionRepository;
import com.lodestar.succession.domain.repository.InMemorySelectionRepository;
import com.lodestar.succession.domain.repository.InMemoryTimelineRepository;
import com.lodestar.succession.domain.repository.InMemoryVoteRepository;
import com.lodestar.succession.domain.service.CycleAdminService;
import com.lodestar.succession.domain.service.CycleDraft;
import com.lodestar.succession.domain.service.CycleLockRegistry;
import com.lodestar.succession.domain.service.CycleLookup;
import com.lodestar.succession.domain.service.PositionDraft;
import com.lodestar.succession.eligibility.EligibilityEngine;
import com.lodestar.succession.eligibility.EligibilityService;
import com.lodestar.succession.eligibility.MemberActivitySource;
import com.lodestar.succession.eligibility.MemberDirectory;
import com.lodestar.succession.evaluation.CriterionDefinition;
import com.lodestar.succession.evaluation.EvaluationService;
import com.lodestar.succession.evaluation.ScoreAggregator;
import com.lodestar.succession.evaluation.ScoreSubmission;
import com.lodestar.succession.interview.InterviewService;
import com.lodestar.succession.lifecycle.CycleEffects;
import com.lodestar.succession.lifecycle.CycleGuards;
import com.lodestar.succession.lifecycle.CycleStateMachine;
import com.lodestar.succession.lifecycle.TransitionTable;
import com.lodestar.succession.meeting.MeetingRequest;
import com.lodestar.succession.meeting.MeetingService;
import com.lodestar.succession.nomination.CandidacySubmission;
import com.lodestar.succession.nomination.NominationService;
import com.lodestar.succession.observability.SuccessionMetrics;
import com.lodestar.succession.observability.SuccessionStructuredLogger;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import com.lodestar.succession.timeline.TimelineService;
import com.lodestar.succession.visibility.ViewerRoleResolver;
import com.lodestar.succession.visibility.VisibilityPolicy;
import com.lodestar.succession.voting.VoteTallyEngine;
import com.lodestar.succession.voting.VotingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Wires the services over in-memory repositories, a {@link MutableClock} and a recording
 * notification dispatcher, and drives cycles through the early stages.
 */
public class SuccessionTestFixture {

    public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");
    public static final String CHAPTER = "chapter-1";
    public static final String ADMIN_ID = "admin-1";

    public final Actor admin = Actor.admin(ADMIN_ID);
    public final MutableClock clock = new MutableClock(START);
    public final SuccessionProperties properties = new SuccessionProperties();
    public final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final RecordingNotificationDispatcher notifications = new RecordingNotificationDispatcher();

    public final InMemoryCycleRepository cycleRepository = new InMemoryCycleRepository();
    public final InMemoryPositionRepository positionRepository = new InMemoryPositionRepository();
    public final InMemoryNominationRepository nominationRepository = new InMemoryNominationRepository();
    public final InMemoryEligibilityRecordRepository eligibilityRecordRepository = new InMemoryEligibilityRecordRepository();
    public final InMemoryEvaluationRepository evaluationRepository = new InMemoryEvaluationRepository();
    public final InMemoryInterviewRepository interviewRepository = new InMemoryInterviewRepository();
    public final InMemoryVoteRepository voteRepository = new InMemoryVoteRepository();
    public final InMemorySelectionRepository selectionRepository = new InMemorySelectionRepository();
    public final InMemoryMeetingRepository meetingRepository = new InMemoryMeetingRepository();
    public final InMemoryApproachRepository approachRepository = new InMemoryApproachRepository();
    public final InMemoryTimelineRepository timelineRepository = new InMemoryTimelineRepository();

    public final CycleLookup cycleLookup;
    public final CycleLockRegistry locks = new CycleLockRegistry();
    public final ChapterPolicyResolver policyResolver;
    public final AuditService auditService;
    public final AuditExporter auditExporter;
    public final SuccessionMetrics metrics;
    public final SuccessionStructuredLogger structuredLogger = new SuccessionStructuredLogger();
    public final EligibilityEngine eligibilityEngine = new EligibilityEngine();
    public final MemberDirectory memberDirectory = new MemberDirectory();
    public final MemberActivitySource activitySource;
    public final EligibilityService eligibilityService;
    public final NominationService nominationService;
    public final EvaluationService evaluationService;
    public final InterviewService interviewService;
    public final MeetingService meetingService;
    public final ApproachService approachService;
    public final TimelineService timelineService;
    public final VotingService votingService;
    public final CycleStateMachine stateMachine;
    public final CycleAdminService adminService;
    public final AutomationStatusTracker automationTracker = new AutomationStatusTracker();
    public final AutomationScheduler automationScheduler;
    public final VisibilityPolicy visibilityPolicy = new VisibilityPolicy();
    public final RecordViewMapper viewMapper;

    public SuccessionTestFixture() {
        this(null);
    }

    /**
     * @param source member data source; {@code null} serves the local member directory
     */
    public SuccessionTestFixture(MemberActivitySource source) {
        properties.getNotifications().getAdminRecipients().add(ADMIN_ID);

        cycleLookup = new CycleLookup(cycleRepository, positionRepository);
        policyResolver = new ChapterPolicyResolver(properties);
        auditService = new AuditService(new InMemoryAuditSink(), objectMapper, clock);
        auditExporter = new AuditExporter(objectMapper);
        metrics = new SuccessionMetrics(meterRegistry);
        activitySource = source != null ? source : new WebClientMemberActivitySource(properties, memberDirectory);

        eligibilityService = new EligibilityService(eligibilityEngine, activitySource, eligibilityRecordRepository,
                positionRepository, nominationRepository, cycleLookup, policyResolver, auditService, notifications,
                metrics, properties, clock);
        nominationService = new NominationService(nominationRepository, eligibilityService, cycleLookup, locks,
                policyResolver, auditService, notifications, metrics, structuredLogger, clock);
        evaluationService = new EvaluationService(evaluationRepository, nominationRepository, positionRepository,
                new ScoreAggregator(), cycleLookup, locks, policyResolver, auditService, notifications, metrics, clock);
        interviewService = new InterviewService(interviewRepository, nominationRepository, cycleLookup, locks,
                auditService, notifications, clock);
        meetingService = new MeetingService(meetingRepository, voteRepository, cycleLookup, locks, auditService,
                notifications, clock);
        approachService = new ApproachService(approachRepository, nominationRepository, cycleLookup, locks,
                auditService, notifications, clock);
        timelineService = new TimelineService(timelineRepository, cycleLookup, locks, auditService, clock);
        votingService = new VotingService(voteRepository, selectionRepository, nominationRepository, meetingRepository,
                approachRepository, evaluationService, new VoteTallyEngine(), cycleLookup, locks, policyResolver,
                auditService, metrics, clock);

        TransitionTable transitionTable = new TransitionTable(
                new CycleGuards(eligibilityEngine, evaluationService, interviewService, votingService),
                new CycleEffects(eligibilityService, evaluationService, votingService, properties));
        stateMachine = new CycleStateMachine(cycleRepository, positionRepository, cycleLookup, locks, transitionTable,
                nominationService, policyResolver, auditService, notifications, metrics, structuredLogger,
                automationTracker, clock);
        adminService = new CycleAdminService(cycleRepository, positionRepository, cycleLookup, locks,
                eligibilityEngine, policyResolver, memberDirectory, auditService, clock);
        automationScheduler = new AutomationScheduler(cycleRepository, stateMachine, evaluationService,
                timelineService, automationTracker, notifications, metrics, structuredLogger, properties, clock);
        viewMapper = new RecordViewMapper(visibilityPolicy,
                new ViewerRoleResolver(nominationRepository, evaluationRepository, interviewRepository));
    }

    // ========== Setup helpers ==========

    public void member(String memberId, double tenureYears) {
        memberDirectory.upsert(CHAPTER, MemberActivity.builder()
                .memberId(memberId)
                .tenureYears(tenureYears)
                .eventsAttended(12)
                .trainingSessions(3)
                .build());
    }

    public SuccessionCycle createCycle() {
        return adminService.createCycle(admin, CycleDraft.builder()
                .chapterId(CHAPTER)
                .year(2026)
                .name("2026 Leadership Cycle")
                .build());
    }

    public Position addPosition(String cycleId, String title) {
        return adminService.addPosition(admin, cycleId, PositionDraft.builder()
                .title(title)
                .hierarchyLevel(1)
                .eligibilityCriteria(EligibilityCriteria.builder().minTenureYears(1.0).build())
                .build(), null);
    }

    public SuccessionCycle transition(String cycleId, CycleStatus target) {
        return stateMachine.transition(admin, cycleId, target, null);
    }

    public SuccessionCycle cycle(String cycleId) {
        return cycleLookup.requireCycle(cycleId);
    }

    public Nomination nominate(String cycleId, String positionId, String nominatorId, String nomineeId) {
        return nominationService.nominate(Actor.member(nominatorId), cycleId, CandidacySubmission.builder()
                .positionId(positionId)
                .nomineeId(nomineeId)
                .justification(justification(nomineeId))
                .build());
    }

    public static String justification(String nomineeId) {
        return (nomineeId + " has run the chapter's mentoring programme for two years, organised every "
                + "regional event this season and consistently steps up when the board needs help.");
    }

    public List<EvaluationCriterion> defineRubric(String positionId) {
        return evaluationService.defineRubric(admin, positionId, List.of(
                CriterionDefinition.builder().name("impact").weight(0.6).build(),
                CriterionDefinition.builder().name("initiative").weight(0.4).build()));
    }

    public void score(Pipeline pipeline, String evaluatorId, String candidateId, double impact, double initiative) {
        submit(pipeline, evaluatorId, candidateId, pipeline.impactId(), impact);
        submit(pipeline, evaluatorId, candidateId, pipeline.initiativeId(), initiative);
    }

    public void submit(Pipeline pipeline, String evaluatorId, String candidateId, String criterionId, double raw) {
        evaluationService.submitScore(Actor.member(evaluatorId), pipeline.cycleId(), ScoreSubmission.builder()
                .positionId(pipeline.positionId())
                .evaluatorId(evaluatorId)
                .candidateId(candidateId)
                .criterionId(criterionId)
                .rawScore(raw)
                .build());
    }

    public List<AuditLogEntry> audit(String cycleId, String action) {
        return auditService.query(AuditFilter.builder().cycleId(cycleId).action(action).build());
    }

    // ========== Pipeline ==========

    /**
     * One position, nominees n1-n3 nominated by m1, evaluators e1 and e2 assigned, rubric
     * {impact 0.6, initiative 0.4}; the cycle is left in {@code evaluations}.
     */
    public Pipeline startEvaluations() {
        for (String nominee : List.of("n1", "n2", "n3")) {
            member(nominee, 3.0);
        }
        member("m1", 0.5);
        member("e1", 6.0);
        member("e2", 6.0);

        SuccessionCycle cycle = createCycle();
        Position position = addPosition(cycle.getId(), "Chapter President");
        transition(cycle.getId(), CycleStatus.ACTIVE);
        transition(cycle.getId(), CycleStatus.NOMINATIONS_OPEN);

        for (String nominee : List.of("n1", "n2", "n3")) {
            nominate(cycle.getId(), position.getId(), "m1", nominee);
            clock.advance(Duration.ofMinutes(1));
        }
        List<EvaluationCriterion> rubric = defineRubric(position.getId());
        evaluationService.assignEvaluators(admin, cycle.getId(), position.getId(), List.of("e1", "e2"), null);

        transition(cycle.getId(), CycleStatus.NOMINATIONS_CLOSED);
        transition(cycle.getId(), CycleStatus.EVALUATIONS);
        return new Pipeline(cycle.getId(), position.getId(), rubric.get(0).getId(), rubric.get(1).getId());
    }

    /**
     * Hand-computed totals on the 0-10 scale: n2 86, n1 70, n3 50.
     */
    public void scoreAll(Pipeline pipeline) {
        score(pipeline, "e1", "n1", 8, 6);
        score(pipeline, "e2", "n1", 6, 8);
        score(pipeline, "e1", "n2", 9, 9);
        score(pipeline, "e2", "n2", 9, 7);
        score(pipeline, "e1", "n3", 5, 5);
        score(pipeline, "e2", "n3", 5, 5);
    }

    /**
     * Scores everything, seats committee c1-c3, moves the cycle into {@code selection} and
     * schedules the steering committee meeting for the next day.
     */
    public Pipeline startSelection() {
        Pipeline pipeline = startEvaluations();
        scoreAll(pipeline);
        transition(pipeline.cycleId(), CycleStatus.EVALUATIONS_CLOSED);
        transition(pipeline.cycleId(), CycleStatus.INTERVIEWS);
        adminService.configureCommittee(admin, pipeline.cycleId(), Set.of("c1", "c2", "c3"));
        transition(pipeline.cycleId(), CycleStatus.INTERVIEWS_CLOSED);
        transition(pipeline.cycleId(), CycleStatus.SELECTION);
        scheduleMeeting(pipeline.cycleId(), MeetingType.STEERING_COMMITTEE);
        return pipeline;
    }

    public Meeting scheduleMeeting(String cycleId, MeetingType type) {
        return meetingService.createMeeting(admin, cycleId, MeetingRequest.builder()
                .meetingType(type)
                .meetingDate(clock.instant().plus(Duration.ofDays(1)))
                .location("Chapter office, boardroom")
                .agenda("Vote on the shortlisted candidates")
                .build());
    }

    /**
     * The first steering committee or final selection meeting of the cycle.
     */
    public String votingMeetingId(String cycleId) {
        return meetingService.listMeetings(cycleId).stream()
                .filter(meeting -> meeting.getMeetingType().isVoting())
                .map(Meeting::getId)
                .findFirst()
                .orElseThrow();
    }

    public record Pipeline(String cycleId, String positionId, String impactId, String initiativeId) {
    }
}
