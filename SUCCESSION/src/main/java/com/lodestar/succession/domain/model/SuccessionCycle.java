package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * One full run of the succession process for a chapter and year.
 * <p>
 * Cycles are never deleted; they end in {@link CycleStatus#ARCHIVED}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SuccessionCycle {

    private String id;

    /** Chapter whose policy applies */
    private String chapterId;

    private int year;

    private String name;

    private String description;

    @Builder.Default
    private CycleStatus status = CycleStatus.DRAFT;

    private LocalDate startDate;

    private LocalDate endDate;

    private boolean published;

    private Instant publishedAt;

    /** Seated selection committee */
    @Builder.Default
    private Set<String> selectionCommitteeIds = new LinkedHashSet<>();

    /** Route through applications_open / applications_closed */
    private boolean applicationsPhaseEnabled;

    /** When each stage should be left */
    @Builder.Default
    private Map<CycleStatus, Instant> stageDeadlines = new EnumMap<>(CycleStatus.class);

    /** Candidate ids per position, frozen on entry to evaluations */
    @Builder.Default
    private Map<String, List<String>> rosterSnapshot = new LinkedHashMap<>();

    @Builder.Default
    private List<StatusChange> statusHistory = new ArrayList<>();

    /** Optimistic concurrency version, bumped on every write */
    private long version;

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;

    public Optional<Instant> deadlineFor(CycleStatus stage) {
        return Optional.ofNullable(stageDeadlines.get(stage));
    }

    public boolean isCommitteeMember(String memberId) {
        return selectionCommitteeIds.contains(memberId);
    }

    public List<String> frozenRoster(String positionId) {
        return rosterSnapshot.getOrDefault(positionId, List.of());
    }

    /**
     * Status a revert returns to. Forward moves push the status they left; reverts pop it, so
     * consecutive reverts keep walking back through the history.
     */
    public Optional<CycleStatus> previousStatus() {
        Deque<CycleStatus> visited = new ArrayDeque<>();
        for (StatusChange change : statusHistory) {
            if (change.isRevert()) {
                visited.pollFirst();
            } else {
                visited.push(change.getFrom());
            }
        }
        return Optional.ofNullable(visited.peekFirst());
    }

    /**
     * Copy with independent collections, so a transition can be prepared without touching the
     * stored instance.
     */
    public SuccessionCycle copy() {
        Map<String, List<String>> roster = new LinkedHashMap<>();
        rosterSnapshot.forEach((positionId, candidates) -> roster.put(positionId, new ArrayList<>(candidates)));
        Map<CycleStatus, Instant> deadlines = new EnumMap<>(CycleStatus.class);
        deadlines.putAll(stageDeadlines);
        return toBuilder()
                .selectionCommitteeIds(new LinkedHashSet<>(selectionCommitteeIds))
                .stageDeadlines(deadlines)
                .rosterSnapshot(roster)
                .statusHistory(new ArrayList<>(statusHistory))
                .build();
    }

    /**
     * One recorded move of the cycle status.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusChange {
        private CycleStatus from;
        private CycleStatus to;
        private String actorId;
        private Instant at;
        private boolean override;
        private boolean revert;
        private String reason;
    }
}
