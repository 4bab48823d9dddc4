package com.lodestar.succession.visibility;

/**
 * Relationship of a viewer to the record being shown. A viewer may hold several at once.
 */
public enum ViewerRole {

    /**
     * Chapter administrator. Sees everything.
     */
    ADMIN,

    /**
     * The candidate the record is about.
     */
    NOMINEE,

    /**
     * Primary or co-nominator of the candidacy.
     */
    NOMINATOR,

    /**
     * Assigned, non-recused evaluator or interview panelist for the candidate.
     */
    EVALUATOR,

    /**
     * Seated selection committee member.
     */
    COMMITTEE,

    /**
     * Any chapter member.
     */
    MEMBER
}
