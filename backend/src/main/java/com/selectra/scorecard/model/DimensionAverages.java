package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DimensionAverages {
    double clarity;
    double accuracy;
    double completeness;
    double confidence;
    double overall;

    public double get(Dimension dimension) {
        return switch (dimension) {
            case CLARITY -> clarity;
            case ACCURACY -> accuracy;
            case COMPLETENESS -> completeness;
            case CONFIDENCE -> confidence;
        };
    }
}
