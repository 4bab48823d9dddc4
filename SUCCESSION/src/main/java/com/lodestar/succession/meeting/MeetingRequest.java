package com.lodestar.succession.meeting;

import com.lodestar.succession.domain.model.Meeting.MeetingType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeetingRequest {
    private MeetingType meetingType;
    private Instant meetingDate;
    private String location;
    private String meetingLink;
    private String agenda;
    private String notes;
}
