package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Position;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryPositionRepository implements PositionRepository {

    private final Map<String, Position> store = new ConcurrentHashMap<>();

    @Override
    public Position save(Position position) {
        store.put(position.getId(), position);
        return position;
    }

    @Override
    public Optional<Position> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Position> findByCycleId(String cycleId) {
        return store.values().stream()
                .filter(position -> cycleId.equals(position.getCycleId()))
                .sorted(Comparator.comparingInt(Position::getHierarchyLevel).thenComparing(Position::getTitle))
                .collect(Collectors.toList());
    }
}
