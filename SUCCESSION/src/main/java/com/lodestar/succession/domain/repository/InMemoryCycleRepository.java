package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.SuccessionCycle;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory cycle store. Hands out copies so callers never mutate the stored state in place.
 */
@Repository
public class InMemoryCycleRepository implements CycleRepository {

    private final Map<String, SuccessionCycle> store = new ConcurrentHashMap<>();

    @Override
    public SuccessionCycle save(SuccessionCycle cycle) {
        store.put(cycle.getId(), cycle.copy());
        return cycle;
    }

    @Override
    public Optional<SuccessionCycle> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(SuccessionCycle::copy);
    }

    @Override
    public List<SuccessionCycle> findAll() {
        return store.values().stream()
                .map(SuccessionCycle::copy)
                .sorted(Comparator.comparing(SuccessionCycle::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @Override
    public List<SuccessionCycle> findOpen() {
        return findAll().stream()
                .filter(cycle -> !cycle.getStatus().isTerminal())
                .collect(Collectors.toList());
    }
}
