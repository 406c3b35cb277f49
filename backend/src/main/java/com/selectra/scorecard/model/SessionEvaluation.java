package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionEvaluation {
    AnswerResult result;
    DimensionAverages runningAverages;
    ReadinessTier readiness;
}
