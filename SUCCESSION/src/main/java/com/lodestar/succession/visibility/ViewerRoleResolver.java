package com.lodestar.succession.visibility;

import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.InterviewSlot;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.EvaluationRepository;
import com.lodestar.succession.domain.repository.InterviewRepository;
import com.lodestar.succession.domain.repository.NominationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Works out which {@link ViewerRole}s an actor holds relative to a record.
 */
@Component
@RequiredArgsConstructor
public class ViewerRoleResolver {

    private final NominationRepository nominationRepository;
    private final EvaluationRepository evaluationRepository;
    private final InterviewRepository interviewRepository;

    /**
     * Roles relative to one candidate of one position.
     */
    public Set<ViewerRole> forCandidate(Actor actor, SuccessionCycle cycle, String positionId, String candidateId) {
        Set<ViewerRole> roles = base(actor, cycle);
        if (actor.id().equals(candidateId)) {
            roles.add(ViewerRole.NOMINEE);
        }
        nominationRepository.findByPositionAndNominee(positionId, candidateId)
                .filter(nomination -> nomination.allNominatorIds().contains(actor.id()))
                .ifPresent(nomination -> roles.add(ViewerRole.NOMINATOR));
        boolean assigned = evaluationRepository.findAssignment(positionId, actor.id(), candidateId)
                .filter(assignment -> !assignment.isRecused())
                .isPresent();
        if (assigned || isPanelist(actor, cycle, positionId, candidateId)) {
            roles.add(ViewerRole.EVALUATOR);
        }
        return roles;
    }

    /**
     * Roles relative to position-wide records such as tallies and rankings.
     */
    public Set<ViewerRole> forPosition(Actor actor, SuccessionCycle cycle, String positionId) {
        Set<ViewerRole> roles = base(actor, cycle);
        boolean evaluator = evaluationRepository.findAssignmentsByPosition(positionId).stream()
                .anyMatch(assignment -> !assignment.isRecused() && assignment.getEvaluatorId().equals(actor.id()));
        if (evaluator) {
            roles.add(ViewerRole.EVALUATOR);
        }
        return roles;
    }

    private Set<ViewerRole> base(Actor actor, SuccessionCycle cycle) {
        Set<ViewerRole> roles = EnumSet.of(ViewerRole.MEMBER);
        if (actor.isAdmin()) {
            roles.add(ViewerRole.ADMIN);
        }
        if (cycle.isCommitteeMember(actor.id())) {
            roles.add(ViewerRole.COMMITTEE);
        }
        return roles;
    }

    private boolean isPanelist(Actor actor, SuccessionCycle cycle, String positionId, String candidateId) {
        for (InterviewSlot slot : interviewRepository.findSlotsByCycle(cycle.getId())) {
            if (positionId.equals(slot.getPositionId()) && candidateId.equals(slot.getCandidateId())
                    && slot.getPanelMemberIds().contains(actor.id())) {
                return true;
            }
        }
        return false;
    }
}
