package com.lodestar.succession.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lodestar.succession.domain.model.EvaluationScore;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Ranked evaluation result of one candidate. {@code evaluatorScores} only ever holds the raw
 * scores the viewer may see: all of them for admins, their own for an evaluator.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateScoreDto {
    private Integer rank;
    private String candidateId;
    private Double total;
    private Map<String, Double> criterionMeans;
    private Integer unanimityCount;
    private Integer evaluatorCount;
    private List<EvaluationScore> evaluatorScores;
}
