package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A committee meeting of a cycle. Ballots cast during selection reference an open voting meeting.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Meeting {

    private String id;

    private String cycleId;

    private MeetingType meetingType;

    private Instant meetingDate;

    private String location;

    private String meetingLink;

    private String agenda;

    private String notes;

    @Builder.Default
    private MeetingStatus status = MeetingStatus.SCHEDULED;

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;

    public enum MeetingType {
        STEERING_COMMITTEE(true),
        RC_REVIEW(false),
        FINAL_SELECTION(true),
        INTERVIEW(false);

        private final boolean voting;

        MeetingType(boolean voting) {
            this.voting = voting;
        }

        /**
         * Whether committee ballots may be cast against meetings of this type.
         */
        public boolean isVoting() {
            return voting;
        }
    }

    public enum MeetingStatus {
        SCHEDULED,
        IN_PROGRESS,
        COMPLETED,
        CANCELLED;

        public boolean isOpen() {
            return this == SCHEDULED || this == IN_PROGRESS;
        }

        /**
         * Scheduled meetings start or get cancelled; running ones complete or get cancelled.
         */
        public boolean canMoveTo(MeetingStatus next) {
            return switch (this) {
                case SCHEDULED -> next == IN_PROGRESS || next == CANCELLED;
                case IN_PROGRESS -> next == COMPLETED || next == CANCELLED;
                case COMPLETED, CANCELLED -> false;
            };
        }
    }
}
