package com.lodestar.succession.api;

import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.model.Actor;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the acting identity from the headers set by the authenticating gateway.
 */
public final class ActorResolver {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ROLES_HEADER = "X-Actor-Roles";

    private ActorResolver() {}

    /**
     * @param roles comma-separated role names, may be null
     */
    public static Actor resolve(String actorId, String roles) {
        if (actorId == null || actorId.isBlank()) {
            throw new AuthorizationException("Missing " + ACTOR_ID_HEADER + " header");
        }
        if (Actor.SYSTEM.id().equals(actorId.trim())) {
            throw new AuthorizationException("The system identity cannot be used over the API");
        }
        Set<String> parsed = roles == null ? Set.of() : Arrays.stream(roles.split(","))
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .map(String::toUpperCase)
                .collect(Collectors.toSet());
        return new Actor(actorId.trim(), parsed);
    }
}
