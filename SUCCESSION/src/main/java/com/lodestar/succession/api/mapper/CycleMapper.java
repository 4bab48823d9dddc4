package com.lodestar.succession.api.mapper;

import com.lodestar.succession.api.dto.CycleDto;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.lifecycle.TransitionTable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper for cycle to DTO conversion.
 */
public final class CycleMapper {

    private CycleMapper() {}

    /**
     * @param includeRoster whether the frozen candidate roster may be shown to the viewer
     */
    public static CycleDto toDto(SuccessionCycle cycle, boolean includeRoster) {
        Map<String, Instant> deadlines = new LinkedHashMap<>();
        cycle.getStageDeadlines().forEach((stage, deadline) -> deadlines.put(stage.name(), deadline));
        return CycleDto.builder()
                .id(cycle.getId())
                .chapterId(cycle.getChapterId())
                .year(cycle.getYear())
                .name(cycle.getName())
                .description(cycle.getDescription())
                .status(cycle.getStatus().name())
                .nextStatus(TransitionTable.forwardTarget(cycle.getStatus(), cycle.isApplicationsPhaseEnabled())
                        .map(CycleStatus::name)
                        .orElse(null))
                .startDate(cycle.getStartDate())
                .endDate(cycle.getEndDate())
                .published(cycle.isPublished())
                .publishedAt(cycle.getPublishedAt())
                .applicationsPhaseEnabled(cycle.isApplicationsPhaseEnabled())
                .selectionCommitteeIds(cycle.getSelectionCommitteeIds())
                .stageDeadlines(deadlines)
                .rosterSnapshot(includeRoster ? cycle.getRosterSnapshot() : null)
                .statusChanges(cycle.getStatusHistory().size())
                .version(cycle.getVersion())
                .createdBy(cycle.getCreatedBy())
                .createdAt(cycle.getCreatedAt())
                .updatedAt(cycle.getUpdatedAt())
                .build();
    }
}
