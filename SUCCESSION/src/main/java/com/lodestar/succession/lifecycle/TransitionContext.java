package com.lodestar.succession.lifecycle;

import com.lodestar.succession.domain.model.Actor;
import com.lodestar.succession.domain.model.CycleStatus;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.notification.NotificationTemplate;
import com.lodestar.succession.policy.ChapterPolicy;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Everything guards and effects of one transition attempt see. {@link #getWorking()} is a
 * private copy of the cycle; notifications queue in the outbox and go out after the commit.
 */
@Getter
public class TransitionContext {

    private final SuccessionCycle working;
    private final CycleStatus from;
    private final CycleStatus to;
    private final Actor actor;
    private final ChapterPolicy policy;
    private final Instant now;
    private final List<Position> activePositions;
    private final List<NotificationRequest> outbox = new ArrayList<>();
    private final Function<List<Position>, Map<String, List<String>>> rosterBuilder;
    private Map<String, List<String>> roster;

    public TransitionContext(SuccessionCycle working, CycleStatus to, Actor actor, ChapterPolicy policy,
                             Instant now, List<Position> activePositions,
                             Function<List<Position>, Map<String, List<String>>> rosterBuilder) {
        this.working = working;
        this.from = working.getStatus();
        this.to = to;
        this.actor = actor;
        this.policy = policy;
        this.now = now;
        this.activePositions = List.copyOf(activePositions);
        this.rosterBuilder = rosterBuilder;
    }

    /**
     * Eligible active candidates per active position, computed once per attempt.
     */
    public Map<String, List<String>> roster() {
        if (roster == null) {
            roster = rosterBuilder.apply(activePositions);
        }
        return roster;
    }

    public void notify(Collection<String> recipients, NotificationTemplate template, Map<String, Object> context) {
        for (String recipient : recipients) {
            outbox.add(NotificationRequest.of(recipient, template, context));
        }
    }
}
