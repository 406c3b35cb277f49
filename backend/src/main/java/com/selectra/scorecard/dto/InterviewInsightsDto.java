package com.selectra.scorecard.dto;

import com.selectra.scorecard.model.DimensionInsight;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.Builder;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewInsightsDto {
    private List<DimensionInsight> strengths;
    private List<DimensionInsight> improvementAreas;
    private List<String> actionableNextSteps;
}
