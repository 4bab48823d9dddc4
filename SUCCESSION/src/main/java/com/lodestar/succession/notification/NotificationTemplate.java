package com.lodestar.succession.notification;

/**
 * Template keys understood by the notification service. Rendering happens there.
 */
public enum NotificationTemplate {
    NOMINATIONS_OPENED("nominations_opened"),
    YOU_ARE_ELIGIBLE("you_are_eligible"),
    YOU_WERE_NOMINATED("you_were_nominated"),
    SECONDMENT_PROPOSED("secondment_proposed"),
    ASSIGNED_EVALUATOR("assigned_evaluator"),
    CANDIDACY_ADVANCED("candidacy_advanced"),
    SCORES_INCOMPLETE("scores_incomplete"),
    INTERVIEW_INVITATION("interview_invitation"),
    INTERVIEW_RESCHEDULED("interview_rescheduled"),
    VOTING_OPENED("voting_opened"),
    YOU_ARE_SELECTED("you_are_selected"),
    NOT_SELECTED("not_selected"),
    PHASE_DEADLINE_WARNING("phase_deadline_warning"),
    AUTOMATION_ESCALATED("automation_escalated"),
    DISQUALIFICATION_RECOMMENDED("disqualification_recommended"),
    MEETING_SCHEDULED("meeting_scheduled"),
    MEETING_CANCELLED("meeting_cancelled"),
    CANDIDATE_APPROACHED("candidate_approached");

    private final String key;

    NotificationTemplate(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
