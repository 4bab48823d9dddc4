package com.lodestar.succession.domain.repository;

import com.lodestar.succession.domain.model.Meeting;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for committee meetings.
 */
public interface MeetingRepository {

    Meeting save(Meeting meeting);

    Optional<Meeting> findById(String meetingId);

    List<Meeting> findByCycle(String cycleId);

    void delete(String meetingId);
}
