package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DimensionScores {
    double clarity;
    double accuracy;
    double completeness;
    double confidence;

    public double get(Dimension dimension) {
        return switch (dimension) {
            case CLARITY -> clarity;
            case ACCURACY -> accuracy;
            case COMPLETENESS -> completeness;
            case CONFIDENCE -> confidence;
        };
    }
}
