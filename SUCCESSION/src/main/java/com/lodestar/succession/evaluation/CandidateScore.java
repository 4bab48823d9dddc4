package com.lodestar.succession.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated evaluation result of one candidate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateScore {

    private int rank;

    private String candidateId;

    private String nominationId;

    /** Weighted total normalized to 0-100 */
    private double total;

    /** Mean raw score per criterion id */
    @Builder.Default
    private Map<String, Double> criterionMeans = new LinkedHashMap<>();

    /** Criteria on which every contributing evaluator gave the same score */
    private int unanimityCount;

    /** Non-recused evaluators with at least one score */
    private int evaluatorCount;

    private Instant nominatedAt;
}
