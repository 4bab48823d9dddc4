package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A scheduled interview for one candidate in front of a panel.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InterviewSlot {

    private String id;

    private String cycleId;

    private String positionId;

    private String candidateId;

    private Instant scheduledAt;

    private int durationMinutes;

    private String location;

    private String meetingLink;

    @Builder.Default
    private Set<String> panelMemberIds = new LinkedHashSet<>();

    @Builder.Default
    private Attendance attendance = Attendance.SCHEDULED;

    private String rescheduleReason;

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;

    public Instant endsAt() {
        return scheduledAt.plusSeconds(durationMinutes * 60L);
    }

    public enum Attendance {
        SCHEDULED,
        ATTENDED,
        NO_SHOW,
        RESCHEDULED,
        CANCELLED
    }
}
