package com.lodestar.succession.api.mapper;

import com.lodestar.succession.api.dto.CandidateScoreDto;
import com.lodestar.succession.api.dto.EligibilityRecordDto;
import com.lodestar.succession.api.dto.FeedbackDto;
import com.lodestar.succession.api.dto.NominationDto;
import com.lodestar.succession.api.dto.ResolutionDto;
import com.lodestar.succession.api.dto.SelectionDto;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.EligibilityRecord;
import com.lodestar.succession.domain.model.EvaluationScore;
import com.lodestar.succession.domain.model.InterviewFeedback;
import com.lodestar.succession.domain.model.InterviewSlot;
import com.lodestar.succession.domain.model.Nomination;
import com.lodestar.succession.domain.model.Selection;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.model.Vote;
import com.lodestar.succession.evaluation.CandidateScore;
import com.lodestar.succession.visibility.RecordType;
import com.lodestar.succession.voting.SelectionResolution;
import com.lodestar.succession.visibility.ViewerRole;
import com.lodestar.succession.visibility.ViewerRoleResolver;
import com.lodestar.succession.visibility.VisibilityPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps confidential records to DTOs, dropping every field the {@link VisibilityPolicy} hides
 * from the viewer at the cycle's current stage. Records with no visible field are left out.
 */
@Component
@RequiredArgsConstructor
public class RecordViewMapper {

    private final VisibilityPolicy visibilityPolicy;
    private final ViewerRoleResolver roleResolver;

    public Optional<NominationDto> nomination(Actor actor, SuccessionCycle cycle, Nomination nomination) {
        Set<String> visible = visible(roleResolver.forCandidate(actor, cycle, nomination.getPositionId(),
                nomination.getNomineeId()), cycle, RecordType.NOMINATION);
        if (visible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(NominationDto.builder()
                .id(pick(visible, "id", nomination.getId()))
                .positionId(pick(visible, "positionId", nomination.getPositionId()))
                .nomineeId(pick(visible, "nomineeId", nomination.getNomineeId()))
                .source(pick(visible, "source", nameOf(nomination.getSource())))
                .status(pick(visible, "status", nameOf(nomination.getStatus())))
                .consentStatus(pick(visible, "consentStatus", nameOf(nomination.getConsentStatus())))
                .nominatorIds(pick(visible, "nominatorIds", nomination.allNominatorIds()))
                .justification(pick(visible, "justification", nomination.getJustification()))
                .evidence(pick(visible, "evidence", nomination.getSupportingEvidence()))
                .submittedAt(pick(visible, "submittedAt", nomination.getSubmittedAt()))
                .withdrawalReason(pick(visible, "withdrawalReason", nomination.getWithdrawalReason()))
                .disqualificationReason(pick(visible, "disqualificationReason", nomination.getDisqualificationReason()))
                .eligibilityPending(pick(visible, "eligibilityPending", nomination.isEligibilityPending()))
                .build());
    }

    public List<NominationDto> nominations(Actor actor, SuccessionCycle cycle, List<Nomination> nominations) {
        return nominations.stream()
                .map(nomination -> nomination(actor, cycle, nomination))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    public Optional<EligibilityRecordDto> eligibility(Actor actor, SuccessionCycle cycle, EligibilityRecord record) {
        Set<String> visible = visible(roleResolver.forCandidate(actor, cycle, record.getPositionId(),
                record.getMemberId()), cycle, RecordType.ELIGIBILITY);
        if (visible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(EligibilityRecordDto.builder()
                .positionId(pick(visible, "positionId", record.getPositionId()))
                .memberId(pick(visible, "memberId", record.getMemberId()))
                .status(pick(visible, "status", nameOf(record.getStatus())))
                .score(pick(visible, "score", record.getScore()))
                .reasons(pick(visible, "reasons", record.getReasons()))
                .checks(pick(visible, "checks", record.getChecks()))
                .computedAt(pick(visible, "computedAt", record.getComputedAt()))
                .build());
    }

    public List<CandidateScoreDto> rankings(Actor actor, SuccessionCycle cycle, String positionId,
                                            List<CandidateScore> rankings, List<EvaluationScore> scores) {
        List<CandidateScoreDto> rows = new ArrayList<>();
        for (CandidateScore score : rankings) {
            Set<ViewerRole> roles = roleResolver.forCandidate(actor, cycle, positionId, score.getCandidateId());
            Set<String> visible = visible(roles, cycle, RecordType.EVALUATION);
            if (visible.isEmpty()) {
                continue;
            }
            List<EvaluationScore> raw = scores.stream()
                    .filter(entry -> entry.getCandidateId().equals(score.getCandidateId()))
                    .filter(entry -> roles.contains(ViewerRole.ADMIN) || entry.getEvaluatorId().equals(actor.id()))
                    .collect(Collectors.toList());
            rows.add(CandidateScoreDto.builder()
                    .rank(pick(visible, "rank", score.getRank()))
                    .candidateId(pick(visible, "candidateId", score.getCandidateId()))
                    .total(pick(visible, "total", score.getTotal()))
                    .criterionMeans(pick(visible, "criterionMeans", score.getCriterionMeans()))
                    .unanimityCount(pick(visible, "unanimityCount", score.getUnanimityCount()))
                    .evaluatorCount(pick(visible, "evaluatorCount", score.getEvaluatorCount()))
                    .evaluatorScores(pick(visible, "evaluatorScores", raw))
                    .build());
        }
        return rows;
    }

    public List<FeedbackDto> feedback(Actor actor, SuccessionCycle cycle, InterviewSlot slot,
                                      List<InterviewFeedback> feedback) {
        Set<String> visible = visible(roleResolver.forCandidate(actor, cycle, slot.getPositionId(),
                slot.getCandidateId()), cycle, RecordType.INTERVIEW_FEEDBACK);
        if (visible.isEmpty()) {
            return List.of();
        }
        return feedback.stream()
                .map(entry -> FeedbackDto.builder()
                        .slotId(pick(visible, "slotId", entry.getSlotId()))
                        .panelistId(pick(visible, "panelistId", entry.getPanelistId()))
                        .overallRating(pick(visible, "overallRating", entry.getOverallRating()))
                        .strengths(pick(visible, "strengths", entry.getStrengths()))
                        .areasForImprovement(pick(visible, "areasForImprovement", entry.getAreasForImprovement()))
                        .recommendation(pick(visible, "recommendation", entry.getRecommendation()))
                        .notes(pick(visible, "notes", entry.getNotes()))
                        .submittedAt(pick(visible, "submittedAt", entry.getSubmittedAt()))
                        .build())
                .collect(Collectors.toList());
    }

    public Optional<ResolutionDto> resolution(Actor actor, SuccessionCycle cycle,
                                              SelectionResolution resolution,
                                              List<Vote> ballots) {
        Set<String> visible = visible(roleResolver.forPosition(actor, cycle, resolution.getPositionId()),
                cycle, RecordType.VOTE);
        if (visible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ResolutionDto.builder()
                .positionId(resolution.getPositionId())
                .requiredYesVotes(pick(visible, "requiredYesVotes", resolution.getRequiredYesVotes()))
                .candidateTallies(pick(visible, "candidateTallies", resolution.getTallies()))
                .qualifying(pick(visible, "qualifying", resolution.getQualifying()))
                .requiresAdminDecision(pick(visible, "qualifying", resolution.isRequiresAdminDecision()))
                .ballots(pick(visible, "ballots", ballots))
                .build());
    }

    public Optional<SelectionDto> selection(Actor actor, SuccessionCycle cycle, Selection selection) {
        Set<String> visible = visible(roleResolver.forCandidate(actor, cycle, selection.getPositionId(),
                selection.getCandidateId()), cycle, RecordType.SELECTION);
        if (visible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SelectionDto.builder()
                .id(pick(visible, "id", selection.getId()))
                .positionId(pick(visible, "positionId", selection.getPositionId()))
                .candidateId(pick(visible, "candidateId", selection.getCandidateId()))
                .rationale(pick(visible, "rationale", selection.getRationale()))
                .decidedBy(pick(visible, "decidedBy", selection.getDecidedBy()))
                .decidedAt(pick(visible, "decidedAt", selection.getDecidedAt()))
                .override(pick(visible, "override", selection.isOverride()))
                .active(pick(visible, "active", selection.isActive()))
                .revocationReason(pick(visible, "revocationReason", selection.getRevocationReason()))
                .build());
    }

    private Set<String> visible(Set<ViewerRole> roles, SuccessionCycle cycle, RecordType recordType) {
        return visibilityPolicy.visibleFields(roles, cycle.getStatus(), recordType);
    }

    private static <T> T pick(Set<String> visible, String field, T value) {
        return visible.contains(field) ? value : null;
    }

    private static String nameOf(Enum<?> value) {
        return value != null ? value.name() : null;
    }
}
