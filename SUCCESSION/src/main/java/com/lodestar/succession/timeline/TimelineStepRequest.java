package com.lodestar.succession.timeline;

import com.lodestar.succession.domain.model.TimelineStep.StepStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineStepRequest {
    private int stepNumber;
    private String stepName;
    private String description;
    private LocalDate startDate;
    private LocalDate endDate;
    private StepStatus status;
    private String autoTriggerAction;
}
