package com.lodestar.succession.domain.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Admin input for creating a cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleDraft {
    private String chapterId;
    private int year;
    private String name;
    private String description;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean applicationsPhaseEnabled;
}
