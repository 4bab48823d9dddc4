package com.lodestar.succession.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Paginated list of cycles.
 */
@Data
@Builder
public class CycleListResponse {
    private List<CycleDto> cycles;
    private long total;
    private int page;
    private int size;
}
