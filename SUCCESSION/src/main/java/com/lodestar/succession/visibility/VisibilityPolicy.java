package com.lodestar.succession.visibility;

import com.lodestar.succession.domain.model.CycleStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.lodestar.succession.domain.model.CycleStatus.*;

/**
 * Which fields of which record a viewer may see at which stage.
 * <p>
 * One table, keyed by record type and role, lists the stages in which a set of fields is
 * granted. Anything not granted is hidden. Admins see every field at every stage.
 */
@Component
public class VisibilityPolicy {

    private static final Set<CycleStatus> ALL_STAGES = EnumSet.allOf(CycleStatus.class);
    private static final Set<CycleStatus> FROM_ROSTER_FREEZE = EnumSet.range(EVALUATIONS, ARCHIVED);
    private static final Set<CycleStatus> EVALUATION_WINDOW = EnumSet.range(EVALUATIONS, INTERVIEWS_CLOSED);
    private static final Set<CycleStatus> AFTER_SCORING = EnumSet.range(EVALUATIONS_CLOSED, ARCHIVED);
    private static final Set<CycleStatus> INTERVIEW_WINDOW = EnumSet.range(EVALUATIONS_CLOSED, ARCHIVED);
    private static final Set<CycleStatus> DELIBERATION = EnumSet.range(INTERVIEWS_CLOSED, ARCHIVED);
    private static final Set<CycleStatus> AFTER_VOTING = EnumSet.range(APPROVAL_PENDING, ARCHIVED);
    private static final Set<CycleStatus> PUBLISHED = EnumSet.of(COMPLETED, ARCHIVED);

    private final Map<RecordType, Map<ViewerRole, List<Grant>>> table = new EnumMap<>(RecordType.class);

    public VisibilityPolicy() {
        // Candidacies: nominators stay anonymous to everyone but admins and fellow nominators
        grant(RecordType.NOMINATION, ViewerRole.NOMINEE, ALL_STAGES,
                "id", "positionId", "nomineeId", "source", "status", "consentStatus", "justification", "evidence",
                "submittedAt", "withdrawalReason", "disqualificationReason", "eligibilityPending");
        grant(RecordType.NOMINATION, ViewerRole.NOMINATOR, ALL_STAGES,
                "id", "positionId", "nomineeId", "source", "status", "consentStatus", "nominatorIds",
                "justification", "evidence", "submittedAt", "withdrawalReason");
        grant(RecordType.NOMINATION, ViewerRole.EVALUATOR, EVALUATION_WINDOW,
                "id", "positionId", "nomineeId", "source", "status", "justification", "evidence");
        grant(RecordType.NOMINATION, ViewerRole.COMMITTEE, DELIBERATION,
                "id", "positionId", "nomineeId", "source", "status", "justification", "evidence");
        grant(RecordType.NOMINATION, ViewerRole.MEMBER, PUBLISHED,
                "positionId", "nomineeId", "status");

        grant(RecordType.ELIGIBILITY, ViewerRole.NOMINEE, ALL_STAGES,
                "positionId", "memberId", "status", "score", "reasons", "checks", "computedAt");
        grant(RecordType.ELIGIBILITY, ViewerRole.EVALUATOR, FROM_ROSTER_FREEZE,
                "positionId", "memberId", "status", "score");
        grant(RecordType.ELIGIBILITY, ViewerRole.COMMITTEE, DELIBERATION,
                "positionId", "memberId", "status", "score", "reasons");

        // Evaluations: evaluators see their own raw scores while scoring, aggregates once scoring closes
        grant(RecordType.EVALUATION, ViewerRole.EVALUATOR, EVALUATION_WINDOW,
                "candidateId", "evaluatorScores");
        grant(RecordType.EVALUATION, ViewerRole.EVALUATOR, AFTER_SCORING,
                "rank", "candidateId", "total", "criterionMeans", "evaluatorCount");
        grant(RecordType.EVALUATION, ViewerRole.COMMITTEE, DELIBERATION,
                "rank", "candidateId", "total", "criterionMeans", "unanimityCount", "evaluatorCount");
        grant(RecordType.EVALUATION, ViewerRole.NOMINEE, PUBLISHED,
                "candidateId", "total");

        grant(RecordType.INTERVIEW_FEEDBACK, ViewerRole.EVALUATOR, INTERVIEW_WINDOW,
                "slotId", "panelistId", "overallRating", "strengths", "areasForImprovement", "recommendation",
                "notes", "submittedAt");
        grant(RecordType.INTERVIEW_FEEDBACK, ViewerRole.COMMITTEE, DELIBERATION,
                "slotId", "overallRating", "strengths", "areasForImprovement", "recommendation");
        grant(RecordType.INTERVIEW_FEEDBACK, ViewerRole.NOMINEE, PUBLISHED,
                "strengths", "areasForImprovement");

        // Ballots stay secret; tallies reach the committee once voting has closed
        grant(RecordType.VOTE, ViewerRole.COMMITTEE, AFTER_VOTING,
                "candidateTallies", "qualifying", "requiredYesVotes");

        grant(RecordType.SELECTION, ViewerRole.COMMITTEE, AFTER_VOTING,
                "id", "positionId", "candidateId", "rationale", "decidedAt", "override", "active");
        grant(RecordType.SELECTION, ViewerRole.NOMINEE, PUBLISHED,
                "positionId", "candidateId", "decidedAt");
        grant(RecordType.SELECTION, ViewerRole.MEMBER, PUBLISHED,
                "positionId", "candidateId", "decidedAt");
    }

    /**
     * Union of the fields granted to any of the viewer's roles at the given stage.
     */
    public Set<String> visibleFields(Collection<ViewerRole> roles, CycleStatus status, RecordType recordType) {
        if (roles.contains(ViewerRole.ADMIN)) {
            return new LinkedHashSet<>(recordType.fields());
        }
        Set<String> granted = new LinkedHashSet<>();
        Map<ViewerRole, List<Grant>> byRole = table.getOrDefault(recordType, Map.of());
        for (ViewerRole role : roles) {
            for (Grant grant : byRole.getOrDefault(role, List.of())) {
                if (grant.stages().contains(status)) {
                    granted.addAll(grant.fields());
                }
            }
        }
        // keep declaration order
        List<String> ordered = new ArrayList<>(recordType.fields());
        ordered.retainAll(granted);
        return Collections.unmodifiableSet(new LinkedHashSet<>(ordered));
    }

    public boolean canSee(Collection<ViewerRole> roles, CycleStatus status, RecordType recordType) {
        return !visibleFields(roles, status, recordType).isEmpty();
    }

    private void grant(RecordType recordType, ViewerRole role, Set<CycleStatus> stages, String... fields) {
        List<String> known = recordType.fields();
        for (String field : fields) {
            if (!known.contains(field)) {
                throw new IllegalArgumentException("Unknown field " + field + " on " + recordType);
            }
        }
        table.computeIfAbsent(recordType, type -> new EnumMap<>(ViewerRole.class))
                .computeIfAbsent(role, r -> new ArrayList<>())
                .add(new Grant(Set.copyOf(stages), Set.of(fields)));
    }

    private record Grant(Set<CycleStatus> stages, Set<String> fields) {
    }
}
