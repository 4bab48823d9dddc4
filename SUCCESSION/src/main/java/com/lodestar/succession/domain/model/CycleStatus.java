package com.lodestar.succession.domain.model;

/**
 * Lifecycle states of a succession cycle.
 * <p>
 * Declaration order is the canonical forward order. {@link #APPLICATIONS_OPEN} and
 * {@link #APPLICATIONS_CLOSED} form the optional branch between nominations and evaluations.
 */
public enum CycleStatus {

    /** Being configured by an admin; positions may be freely edited. */
    DRAFT,

    /** Published to members; nominations have not opened yet. */
    ACTIVE,

    NOMINATIONS_OPEN,
    NOMINATIONS_CLOSED,
    APPLICATIONS_OPEN,
    APPLICATIONS_CLOSED,

    /** Evaluators score the frozen candidate roster. */
    EVALUATIONS,
    EVALUATIONS_CLOSED,
    INTERVIEWS,
    INTERVIEWS_CLOSED,

    /** Selection committee casts ballots. */
    SELECTION,

    /** Selections recorded, waiting for final admin approval. */
    APPROVAL_PENDING,

    COMPLETED,
    ARCHIVED;

    public boolean isTerminal() {
        return this == ARCHIVED;
    }

    /**
     * Whether new nominations or secondment proposals are accepted.
     */
    public boolean acceptsNominations() {
        return this == NOMINATIONS_OPEN;
    }

    /**
     * Whether self-applications are accepted.
     */
    public boolean acceptsApplications() {
        return this == NOMINATIONS_OPEN || this == APPLICATIONS_OPEN;
    }

    public boolean acceptsScores() {
        return this == EVALUATIONS;
    }

    public boolean acceptsInterviewScheduling() {
        return this == EVALUATIONS_CLOSED || this == INTERVIEWS;
    }

    public boolean acceptsBallots() {
        return this == SELECTION;
    }

    /**
     * Whether positions are still freely editable without an admin override.
     */
    public boolean allowsPositionEdits() {
        return this == DRAFT || this == ACTIVE;
    }

    /**
     * Whether the candidate roster has been frozen for scoring.
     */
    public boolean isRosterFrozen() {
        return ordinal() >= EVALUATIONS.ordinal();
    }
}
