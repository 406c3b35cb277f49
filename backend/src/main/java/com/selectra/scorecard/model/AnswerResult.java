package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnswerResult {
    int questionId;
    QuestionSpec question;
    String answer;
    Signals signals;
    DimensionScores scores;
    List<Explanation> explanations;
    Map<String, Suggestion> suggestions;
}
