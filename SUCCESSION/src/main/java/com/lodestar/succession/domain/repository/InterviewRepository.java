package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.InterviewFeedback;
import com.lodestar.succession.domain.model.InterviewSlot;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for interview slots and panel feedback.
 */
public interface InterviewRepository {

    InterviewSlot saveSlot(InterviewSlot slot);

    Optional<InterviewSlot> findSlot(String slotId);

    List<InterviewSlot> findSlotsByCycle(String cycleId);

    /**
     * Insert or overwrite the feedback stored under (slot, panelist).
     */
    InterviewFeedback upsertFeedback(InterviewFeedback feedback);

    List<InterviewFeedback> findFeedbackBySlot(String slotId);
}
