package com.selectra.scorecard.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.Builder;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalSummaryDto {
    private Integer wordCount;
    private Integer sentenceCount;
    private List<String> matchedKeywords;
    private List<String> fillerWordsFound;
    private Boolean hasExamples;
    private Boolean isGibberish;
    private Double realWordRatio;
}
