package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.EligibilityRecord;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for derived eligibility records, keyed by (position, member).
 */
public interface EligibilityRecordRepository {

    EligibilityRecord save(EligibilityRecord record);

    Optional<EligibilityRecord> find(String positionId, String memberId);

    List<EligibilityRecord> findByPositionId(String positionId);
}
