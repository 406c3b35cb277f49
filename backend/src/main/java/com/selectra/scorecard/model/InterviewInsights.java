package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InterviewInsights {
    double overall;
    DimensionAverages averages;
    ReadinessTier readiness;
    List<DimensionInsight> strengths;
    List<DimensionInsight> improvements;
    List<String> nextSteps;
}
