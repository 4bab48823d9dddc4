package com.lodestar.succession.approach;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApproachRequest {
    private String positionId;
    private String nomineeId;
    private String notes;
}
