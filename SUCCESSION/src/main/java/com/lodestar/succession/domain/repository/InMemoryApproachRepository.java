package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.CandidateApproach;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Repository
public class InMemoryApproachRepository implements ApproachRepository {

    private final Map<String, CandidateApproach> store = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean insert(CandidateApproach approach) {
        if (findByPositionAndNominee(approach.getPositionId(), approach.getNomineeId()).isPresent()) {
            return false;
        }
        store.put(approach.getId(), approach);
        return true;
    }

    @Override
    public CandidateApproach update(String approachId, UnaryOperator<CandidateApproach> update) {
        return store.computeIfPresent(approachId, (id, current) -> update.apply(current));
    }

    @Override
    public Optional<CandidateApproach> findById(String approachId) {
        return Optional.ofNullable(store.get(approachId));
    }

    @Override
    public Optional<CandidateApproach> findByPositionAndNominee(String positionId, String nomineeId) {
        return store.values().stream()
                .filter(approach -> positionId.equals(approach.getPositionId())
                        && nomineeId.equals(approach.getNomineeId()))
                .findFirst();
    }

    @Override
    public List<CandidateApproach> findByCycle(String cycleId) {
        return store.values().stream()
                .filter(approach -> cycleId.equals(approach.getCycleId()))
                .sorted(Comparator.comparing(CandidateApproach::getApproachedAt).thenComparing(CandidateApproach::getId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void delete(String approachId) {
        store.remove(approachId);
    }
}
