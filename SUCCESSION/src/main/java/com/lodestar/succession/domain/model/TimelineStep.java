package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One step of a cycle's published timeline. Dates are inclusive.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TimelineStep {

    private String id;

    private String cycleId;

    private int stepNumber;

    private String stepName;

    private String description;

    private LocalDate startDate;

    private LocalDate endDate;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    private String autoTriggerAction;

    private Instant updatedAt;

    public enum StepStatus {
        PENDING,
        ACTIVE,
        COMPLETED,
        OVERDUE
    }
}
