package com.lodestar.succession.interview;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotRequest {
    private String positionId;
    private String candidateId;
    private Instant scheduledAt;
    private int durationMinutes;
    private String location;
    private String meetingLink;
    @Builder.Default
    private List<String> panelMemberIds = new ArrayList<>();
}
