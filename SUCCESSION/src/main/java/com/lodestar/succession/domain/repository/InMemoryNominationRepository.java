package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Nomination;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Repository
public class InMemoryNominationRepository implements NominationRepository {

    private final Map<String, Nomination> byCandidacy = new ConcurrentHashMap<>();
    private final Map<String, String> candidacyKeyById = new ConcurrentHashMap<>();

    @Override
    public Nomination save(Nomination nomination) {
        String key = key(nomination.getPositionId(), nomination.getNomineeId());
        byCandidacy.put(key, nomination);
        candidacyKeyById.put(nomination.getId(), key);
        return nomination;
    }

    @Override
    public Optional<Nomination> findById(String id) {
        return Optional.ofNullable(candidacyKeyById.get(id)).map(byCandidacy::get);
    }

    @Override
    public Optional<Nomination> findByPositionAndNominee(String positionId, String nomineeId) {
        return Optional.ofNullable(byCandidacy.get(key(positionId, nomineeId)));
    }

    @Override
    public Nomination upsert(String positionId, String nomineeId, UnaryOperator<Nomination> remapping) {
        Nomination stored = byCandidacy.compute(key(positionId, nomineeId), (key, current) -> remapping.apply(current));
        candidacyKeyById.put(stored.getId(), key(positionId, nomineeId));
        return stored;
    }

    @Override
    public List<Nomination> findByCycleId(String cycleId) {
        return byCandidacy.values().stream()
                .filter(nomination -> cycleId.equals(nomination.getCycleId()))
                .sorted(Comparator.comparing(Nomination::getSubmittedAt).thenComparing(Nomination::getNomineeId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Nomination> findByPositionId(String positionId) {
        return byCandidacy.values().stream()
                .filter(nomination -> positionId.equals(nomination.getPositionId()))
                .sorted(Comparator.comparing(Nomination::getSubmittedAt).thenComparing(Nomination::getNomineeId))
                .collect(Collectors.toList());
    }

    private static String key(String positionId, String nomineeId) {
        return positionId + '|' + nomineeId;
    }
}
