package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InterviewReport {
    List<AnswerResult> answers;
    InterviewInsights insights;
}
