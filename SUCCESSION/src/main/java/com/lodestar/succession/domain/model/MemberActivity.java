package com.lodestar.succession.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read-only snapshot of a member's history, as returned by the member data service.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemberActivity {

    private String memberId;

    private double tenureYears;

    private int eventsAttended;

    private int trainingSessions;

    private int peerNominations;

    /** Whether the member has held at least one leadership position */
    private boolean leadershipExperience;

    @Builder.Default
    private Set<String> priorRoles = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> skills = new LinkedHashSet<>();
}
