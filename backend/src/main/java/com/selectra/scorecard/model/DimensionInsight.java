package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DimensionInsight {
    String name;
    double score;
    String note;
}
