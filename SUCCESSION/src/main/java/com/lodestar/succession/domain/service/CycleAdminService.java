package com.lodestar.succession.domain.service;

import com.lodestar.succession.audit.AuditService;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.ValidationException;
import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.EligibilityCriteria;
import com.lodestar.succession.domain.model.MemberActivity;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.CycleRepository;
import com.lodestar.succession.domain.repository.PositionRepository;
import com.lodestar.succession.eligibility.EligibilityEngine;
import com.lodestar.succession.eligibility.MemberDirectory;
import com.lodestar.succession.policy.ChapterPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Cycle and position administration: creation, positions, committee, deadlines.
 * <p>
 * Settings changes run under the cycle write lock and bump the cycle version. Position edits
 * are free while the cycle is {@code draft} or {@code active}; afterwards they need an override
 * reason, and they stop entirely once the cycle is completed.
 */
@Slf4j
@Service
public class CycleAdminService {

    private final CycleRepository cycleRepository;
    private final PositionRepository positionRepository;
    private final CycleLookup cycleLookup;
    private final CycleLockRegistry locks;
    private final EligibilityEngine eligibilityEngine;
    private final ChapterPolicyResolver policyResolver;
    private final MemberDirectory memberDirectory;
    private final AuditService auditService;
    private final Clock clock;

    public CycleAdminService(CycleRepository cycleRepository,
                             PositionRepository positionRepository,
                             CycleLookup cycleLookup,
                             CycleLockRegistry locks,
                             EligibilityEngine eligibilityEngine,
                             ChapterPolicyResolver policyResolver,
                             MemberDirectory memberDirectory,
                             AuditService auditService,
                             Clock clock) {
        this.cycleRepository = cycleRepository;
        this.positionRepository = positionRepository;
        this.cycleLookup = cycleLookup;
        this.locks = locks;
        this.eligibilityEngine = eligibilityEngine;
        this.policyResolver = policyResolver;
        this.memberDirectory = memberDirectory;
        this.auditService = auditService;
        this.clock = clock;
    }

    // ========== Cycles ==========

    public SuccessionCycle createCycle(Actor actor, CycleDraft draft) {
        CycleLookup.requireAdmin(actor, "create a cycle");
        Map<String, String> errors = new LinkedHashMap<>();
        if (isBlank(draft.getChapterId())) {
            errors.put("chapterId", "is required");
        }
        if (isBlank(draft.getName())) {
            errors.put("name", "is required");
        }
        if (draft.getYear() < 1900) {
            errors.put("year", "must be a calendar year");
        }
        if (draft.getStartDate() != null && draft.getEndDate() != null
                && draft.getEndDate().isBefore(draft.getStartDate())) {
            errors.put("endDate", "must not be before startDate");
        }
        ValidationException.throwIfAny(errors, null);

        Instant now = clock.instant();
        SuccessionCycle cycle = SuccessionCycle.builder()
                .id(UUID.randomUUID().toString())
                .chapterId(draft.getChapterId().trim())
                .year(draft.getYear())
                .name(draft.getName().trim())
                .description(draft.getDescription())
                .startDate(draft.getStartDate())
                .endDate(draft.getEndDate())
                .applicationsPhaseEnabled(draft.isApplicationsPhaseEnabled())
                .createdBy(actor.id())
                .createdAt(now)
                .updatedAt(now)
                .build();
        cycleRepository.save(cycle);
        auditService.record(cycle.getId(), actor, "cycle.create", "Cycle", cycle.getId(),
                "Created cycle '" + cycle.getName() + "' for " + cycle.getChapterId() + " " + cycle.getYear(),
                null, cycle);
        log.info("Created succession cycle {} ({}) for chapter {}", cycle.getId(), cycle.getName(), cycle.getChapterId());
        return cycle;
    }

    public SuccessionCycle getCycle(String cycleId) {
        return cycleLookup.requireCycle(cycleId);
    }

    public List<SuccessionCycle> listCycles() {
        return cycleRepository.findAll();
    }

    /**
     * Seat the selection committee. The committee is fixed once voting opens.
     */
    public SuccessionCycle configureCommittee(Actor actor, String cycleId, Set<String> memberIds) {
        CycleLookup.requireAdmin(actor, "configure the selection committee");
        if (memberIds == null || memberIds.stream().anyMatch(CycleAdminService::isBlank)) {
            throw new ValidationException("selectionCommitteeIds", "must be a list of member ids");
        }
        return updateCycle(actor, cycleId, "cycle.committee", cycle -> {
            if (cycle.getStatus().ordinal() >= CycleStatus.SELECTION.ordinal()) {
                throw new ConflictException("The committee cannot change once voting has opened", cycle.getStatus());
            }
            cycle.setSelectionCommitteeIds(new LinkedHashSet<>(memberIds));
        }, "Committee set to " + memberIds);
    }

    /**
     * Replace the stage deadlines. Deadlines for stages already left are kept for the record.
     */
    public SuccessionCycle setDeadlines(Actor actor, String cycleId, Map<CycleStatus, Instant> deadlines) {
        CycleLookup.requireAdmin(actor, "set stage deadlines");
        if (deadlines == null) {
            throw new ValidationException("stageDeadlines", "is required");
        }
        Map<String, String> errors = new LinkedHashMap<>();
        deadlines.forEach((stage, deadline) -> {
            if (deadline == null) {
                errors.put(stage.name(), "deadline is required");
            } else if (stage.isTerminal()) {
                errors.put(stage.name(), "final status has no deadline");
            }
        });
        ValidationException.throwIfAny(errors, null);
        return updateCycle(actor, cycleId, "cycle.deadlines", cycle -> {
            if (cycle.getStatus().isTerminal()) {
                throw new ConflictException("An archived cycle cannot be changed", cycle.getStatus());
            }
            Map<CycleStatus, Instant> merged = new EnumMap<>(CycleStatus.class);
            merged.putAll(cycle.getStageDeadlines());
            merged.putAll(deadlines);
            cycle.setStageDeadlines(merged);
        }, "Deadlines set for " + deadlines.keySet());
    }

    /**
     * Turn the applications phase on or off. Only possible before the cycle reaches the branch.
     */
    public SuccessionCycle setApplicationsPhase(Actor actor, String cycleId, boolean enabled) {
        CycleLookup.requireAdmin(actor, "configure the applications phase");
        return updateCycle(actor, cycleId, "cycle.applications-phase", cycle -> {
            if (cycle.getStatus().ordinal() > CycleStatus.NOMINATIONS_CLOSED.ordinal()) {
                throw new ConflictException("The applications phase can no longer be changed", cycle.getStatus());
            }
            cycle.setApplicationsPhaseEnabled(enabled);
        }, "Applications phase " + (enabled ? "enabled" : "disabled"));
    }

    private SuccessionCycle updateCycle(Actor actor, String cycleId, String action,
                                        Consumer<SuccessionCycle> change, String summary) {
        return locks.withWriteLock(cycleId, () -> {
            SuccessionCycle before = cycleLookup.requireCycle(cycleId);
            SuccessionCycle after = before.copy();
            change.accept(after);
            after.setVersion(before.getVersion() + 1);
            after.setUpdatedAt(clock.instant());
            cycleRepository.save(after);
            auditService.record(cycleId, actor, action, "Cycle", cycleId, summary, before, after);
            return after;
        });
    }

    // ========== Positions ==========

    public Position addPosition(Actor actor, String cycleId, PositionDraft draft, String overrideReason) {
        CycleLookup.requireAdmin(actor, "add a position");
        return locks.withWriteLock(cycleId, () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(cycleId);
            boolean override = requirePositionEditable(cycle, overrideReason);
            validatePosition(cycle, draft);
            Instant now = clock.instant();
            Position position = Position.builder()
                    .id(UUID.randomUUID().toString())
                    .cycleId(cycleId)
                    .title(draft.getTitle().trim())
                    .description(draft.getDescription())
                    .hierarchyLevel(draft.getHierarchyLevel())
                    .numberOfOpenings(draft.getNumberOfOpenings())
                    .eligibilityCriteria(criteriaOf(draft))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            positionRepository.save(position);
            auditService.record(cycleId, actor, override ? "position.override" : "position.create", "Position",
                    position.getId(), summary("Added position '" + position.getTitle() + "'", overrideReason),
                    null, position);
            return position;
        });
    }

    public Position updatePosition(Actor actor, String positionId, PositionDraft draft, String overrideReason) {
        CycleLookup.requireAdmin(actor, "edit a position");
        Position existing = cycleLookup.requirePosition(positionId);
        return locks.withWriteLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            boolean override = requirePositionEditable(cycle, overrideReason);
            validatePosition(cycle, draft);
            Position before = cycleLookup.requirePosition(positionId);
            Position after = before.toBuilder()
                    .title(draft.getTitle().trim())
                    .description(draft.getDescription())
                    .hierarchyLevel(draft.getHierarchyLevel())
                    .numberOfOpenings(draft.getNumberOfOpenings())
                    .eligibilityCriteria(criteriaOf(draft))
                    .updatedAt(clock.instant())
                    .build();
            positionRepository.save(after);
            auditService.record(cycle.getId(), actor, override ? "position.override" : "position.update", "Position",
                    positionId, summary("Updated position '" + after.getTitle() + "'", overrideReason), before, after);
            return after;
        });
    }

    public Position deactivatePosition(Actor actor, String positionId, String overrideReason) {
        CycleLookup.requireAdmin(actor, "deactivate a position");
        Position existing = cycleLookup.requirePosition(positionId);
        return locks.withWriteLock(existing.getCycleId(), () -> {
            SuccessionCycle cycle = cycleLookup.requireCycle(existing.getCycleId());
            boolean override = requirePositionEditable(cycle, overrideReason);
            Position before = cycleLookup.requirePosition(positionId);
            Position after = before.toBuilder()
                    .active(false)
                    .updatedAt(clock.instant())
                    .build();
            positionRepository.save(after);
            auditService.record(cycle.getId(), actor, override ? "position.override" : "position.deactivate",
                    "Position", positionId, summary("Deactivated position '" + after.getTitle() + "'", overrideReason),
                    before, after);
            return after;
        });
    }

    public List<Position> listPositions(String cycleId) {
        cycleLookup.requireCycle(cycleId);
        return positionRepository.findByCycleId(cycleId);
    }

    // ========== Member data ==========

    /**
     * Register activity data in the in-memory directory used when no member data service is configured.
     */
    public void registerMemberActivity(Actor actor, String chapterId, MemberActivity activity) {
        CycleLookup.requireAdmin(actor, "register member activity");
        if (isBlank(chapterId) || activity == null || isBlank(activity.getMemberId())) {
            throw new ValidationException("memberId", "chapter and member id are required");
        }
        memberDirectory.upsert(chapterId, activity);
        log.debug("Registered activity of member {} in chapter {}", activity.getMemberId(), chapterId);
    }

    /**
     * @return whether the edit is an override
     */
    private boolean requirePositionEditable(SuccessionCycle cycle, String overrideReason) {
        CycleStatus status = cycle.getStatus();
        if (status.allowsPositionEdits()) {
            return false;
        }
        if (status == CycleStatus.COMPLETED || status.isTerminal()) {
            throw new ConflictException("Positions cannot change once the cycle is " + status, status);
        }
        if (isBlank(overrideReason)) {
            throw new ValidationException(Map.of("overrideReason", "is required to edit positions while the cycle is " + status),
                    status);
        }
        return true;
    }

    private void validatePosition(SuccessionCycle cycle, PositionDraft draft) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (draft == null) {
            throw new ValidationException("position", "is required");
        }
        if (isBlank(draft.getTitle())) {
            errors.put("title", "is required");
        }
        if (draft.getHierarchyLevel() < 1) {
            errors.put("hierarchyLevel", "must be at least 1");
        }
        if (draft.getNumberOfOpenings() < 1) {
            errors.put("numberOfOpenings", "must be at least 1");
        }
        eligibilityEngine.validate(criteriaOf(draft), policyResolver.forCycle(cycle))
                .forEach((field, problem) -> errors.put("eligibilityCriteria." + field, problem));
        ValidationException.throwIfAny(errors, cycle.getStatus());
    }

    private static EligibilityCriteria criteriaOf(PositionDraft draft) {
        return draft.getEligibilityCriteria() != null ? draft.getEligibilityCriteria() : new EligibilityCriteria();
    }

    private static String summary(String text, String overrideReason) {
        return isBlank(overrideReason) ? text : text + " (override: " + overrideReason.trim() + ")";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
