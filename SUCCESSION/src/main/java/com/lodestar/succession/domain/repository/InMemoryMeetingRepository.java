package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Meeting;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryMeetingRepository implements MeetingRepository {

    private final Map<String, Meeting> store = new ConcurrentHashMap<>();

    @Override
    public Meeting save(Meeting meeting) {
        store.put(meeting.getId(), meeting);
        return meeting;
    }

    @Override
    public Optional<Meeting> findById(String meetingId) {
        return Optional.ofNullable(store.get(meetingId));
    }

    @Override
    public List<Meeting> findByCycle(String cycleId) {
        return store.values().stream()
                .filter(meeting -> cycleId.equals(meeting.getCycleId()))
                .sorted(Comparator.comparing(Meeting::getMeetingDate).thenComparing(Meeting::getId))
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String meetingId) {
        store.remove(meetingId);
    }
}
