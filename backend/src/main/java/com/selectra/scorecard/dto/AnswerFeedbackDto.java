package com.selectra.scorecard.dto;

import com.selectra.scorecard.model.DimensionAverages;
import com.selectra.scorecard.model.DimensionScores;
import com.selectra.scorecard.model.Explanation;
import com.selectra.scorecard.model.ReadinessTier;
import com.selectra.scorecard.model.Suggestion;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.Builder;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnswerFeedbackDto {
    private Integer questionId;
    private DimensionScores scores;
    private List<Explanation> explanations;
    private Map<String, Suggestion> suggestions;
    private SignalSummaryDto signals;
    private DimensionAverages runningAverages;
    private ReadinessTier readiness;
}
