package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.TimelineStep;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryTimelineRepository implements TimelineRepository {

    private final Map<String, TimelineStep> store = new ConcurrentHashMap<>();

    @Override
    public TimelineStep save(TimelineStep step) {
        store.put(step.getId(), step);
        return step;
    }

    @Override
    public Optional<TimelineStep> findById(String stepId) {
        return Optional.ofNullable(store.get(stepId));
    }

    @Override
    public List<TimelineStep> findByCycle(String cycleId) {
        return store.values().stream()
                .filter(step -> cycleId.equals(step.getCycleId()))
                .sorted(Comparator.comparingInt(TimelineStep::getStepNumber).thenComparing(TimelineStep::getId))
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String stepId) {
        store.remove(stepId);
    }
}
