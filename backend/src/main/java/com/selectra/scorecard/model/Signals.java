package com.selectra.scorecard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Measurable properties of a single answer. Every score, explanation and
 * suggestion is derived from these values alone.
 */
@Value
@Builder
public class Signals {
    int wordCount;
    int sentenceCount;
    double uniqueRatio;
    List<String> matchedKeywords;
    int totalKeywords;
    double keywordMatchRatio;
    List<String> fillerWordsFound;
    int fillerCount;
    List<String> assertiveFound;
    boolean hasExamples;
    boolean startsWithCapital;
    int avgSentenceLen;
    double realWordRatio;
    @JsonProperty("isGibberish")
    boolean gibberish;
}
