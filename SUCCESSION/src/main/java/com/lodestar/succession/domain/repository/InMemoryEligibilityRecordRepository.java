package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.EligibilityRecord;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryEligibilityRecordRepository implements EligibilityRecordRepository {

    private final Map<String, EligibilityRecord> store = new ConcurrentHashMap<>();

    @Override
    public EligibilityRecord save(EligibilityRecord record) {
        store.put(key(record.getPositionId(), record.getMemberId()), record);
        return record;
    }

    @Override
    public Optional<EligibilityRecord> find(String positionId, String memberId) {
        return Optional.ofNullable(store.get(key(positionId, memberId)));
    }

    @Override
    public List<EligibilityRecord> findByPositionId(String positionId) {
        return store.values().stream()
                .filter(record -> positionId.equals(record.getPositionId()))
                .sorted(Comparator.comparing(EligibilityRecord::getMemberId))
                .collect(Collectors.toList());
    }

    private static String key(String positionId, String memberId) {
        return positionId + '|' + memberId;
    }
}
