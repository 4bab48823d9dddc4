package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.InterviewFeedback;
import com.lodestar.succession.domain.model.InterviewSlot;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryInterviewRepository implements InterviewRepository {

    private final Map<String, InterviewSlot> slots = new ConcurrentHashMap<>();
    private final Map<String, InterviewFeedback> feedback = new ConcurrentHashMap<>();

    @Override
    public InterviewSlot saveSlot(InterviewSlot slot) {
        slots.put(slot.getId(), slot);
        return slot;
    }

    @Override
    public Optional<InterviewSlot> findSlot(String slotId) {
        return Optional.ofNullable(slots.get(slotId));
    }

    @Override
    public List<InterviewSlot> findSlotsByCycle(String cycleId) {
        return slots.values().stream()
                .filter(slot -> cycleId.equals(slot.getCycleId()))
                .sorted(Comparator.comparing(InterviewSlot::getScheduledAt).thenComparing(InterviewSlot::getId))
                .collect(Collectors.toList());
    }

    @Override
    public InterviewFeedback upsertFeedback(InterviewFeedback entry) {
        return feedback.compute(entry.getSlotId() + '|' + entry.getPanelistId(), (key, existing) -> entry);
    }

    @Override
    public List<InterviewFeedback> findFeedbackBySlot(String slotId) {
        return feedback.values().stream()
                .filter(entry -> slotId.equals(entry.getSlotId()))
                .sorted(Comparator.comparing(InterviewFeedback::getPanelistId))
                .collect(Collectors.toList());
    }
}
