package com.lodestar.succession.domain.model;

import java.util.Set;

/**
 * The acting identity of a request. Authentication happens upstream; this carries only the
 * member id and platform roles.
 *
 * @param id    member id, or {@code system} for the scheduler
 * @param roles platform roles, e.g. {@code ADMIN}
 */
public record Actor(String id, Set<String> roles) {

    public static final String ADMIN_ROLE = "ADMIN";
    public static final Actor SYSTEM = new Actor("system", Set.of(ADMIN_ROLE));

    public Actor {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static Actor member(String id) {
        return new Actor(id, Set.of());
    }

    public static Actor admin(String id) {
        return new Actor(id, Set.of(ADMIN_ROLE));
    }

    public boolean isAdmin() {
        return roles.contains(ADMIN_ROLE);
    }

    public boolean isSystem() {
        return SYSTEM.id().equals(id);
    }
}
