package com.lodestar.succession.health;

import com.lodestar.succession.automation.AutomationStatusTracker;
import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.model.SuccessionCycle;
import com.lodestar.succession.domain.repository.CycleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health indicator for the succession service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Open cycles by status</li>
 *     <li>Cycles whose automation has been escalated</li>
 *     <li>Member data and notification transport configuration</li>
 * </ul>
 * Escalations are surfaced as details only; they need admin attention, not a restart.
 */
@Slf4j
@Component
public class SuccessionHealthIndicator implements ReactiveHealthIndicator {

    private final CycleRepository cycleRepository;
    private final AutomationStatusTracker automationStatusTracker;
    private final SuccessionProperties properties;

    public SuccessionHealthIndicator(CycleRepository cycleRepository,
                                     AutomationStatusTracker automationStatusTracker,
                                     SuccessionProperties properties) {
        this.cycleRepository = cycleRepository;
        this.automationStatusTracker = automationStatusTracker;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        List<SuccessionCycle> open = cycleRepository.findOpen();
        details.put("openCycles", open.size());
        details.put("cyclesByStatus", open.stream()
                .collect(Collectors.groupingBy(cycle -> cycle.getStatus().name(), Collectors.counting())));

        List<String> escalated = open.stream()
                .map(SuccessionCycle::getId)
                .filter(id -> automationStatusTracker.status(id).escalated())
                .collect(Collectors.toList());
        details.put("escalatedCycles", escalated);
        details.put("automation.enabled", properties.getAutomation().isEnabled());
        details.put("memberData.mode", properties.getMemberData().getBaseUrl().isBlank() ? "directory" : "remote");
        details.put("notifications.transport", properties.getNotifications().getTransport());

        if (!escalated.isEmpty()) {
            log.debug("Health check: {} escalated cycle(s)", escalated.size());
        }
        return Health.up().withDetails(details).build();
    }
}
