package com.lodestar.succession.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DTO for cycle representation in API responses.
 */
@Data
@Builder
public class CycleDto {
    private String id;
    private String chapterId;
    private int year;
    private String name;
    private String description;
    private String status;
    private String nextStatus;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean published;
    private Instant publishedAt;
    private boolean applicationsPhaseEnabled;
    private Set<String> selectionCommitteeIds;
    private Map<String, Instant> stageDeadlines;
    private Map<String, List<String>> rosterSnapshot;
    private int statusChanges;
    private long version;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
