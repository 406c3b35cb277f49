package com.selectra.scorecard.dto;

import com.selectra.scorecard.model.ReadinessTier;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinalReportDto {
    private String appName;
    private String tagline;
    private LocalDateTime generatedAt;
    private InterviewerDto interviewer;
    private Double overallScore;
    private Map<String, Double> dimensionAverages;
    private ReadinessTier readinessIndicator;
    private InterviewInsightsDto interviewInsights;
    private List<ResponseEntryDto> responses;
}
