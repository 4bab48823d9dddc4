package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Selection;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemorySelectionRepository implements SelectionRepository {

    private final Map<String, Selection> store = new ConcurrentHashMap<>();
    private final Map<String, String> activeByPosition = new ConcurrentHashMap<>();

    @Override
    public boolean insertActive(Selection selection) {
        if (activeByPosition.putIfAbsent(selection.getPositionId(), selection.getId()) != null) {
            return false;
        }
        store.put(selection.getId(), selection);
        return true;
    }

    @Override
    public Selection update(Selection selection) {
        store.put(selection.getId(), selection);
        if (!selection.isActive()) {
            activeByPosition.remove(selection.getPositionId(), selection.getId());
        }
        return selection;
    }

    @Override
    public Optional<Selection> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public Optional<Selection> findActiveByPosition(String positionId) {
        return Optional.ofNullable(activeByPosition.get(positionId)).map(store::get);
    }

    @Override
    public List<Selection> findByCycle(String cycleId) {
        return store.values().stream()
                .filter(selection -> cycleId.equals(selection.getCycleId()))
                .sorted(Comparator.comparing(Selection::getDecidedAt))
                .collect(Collectors.toList());
    }
}
