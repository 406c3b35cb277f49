package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Explanation {
    String dimension;
    double score;
    String text;
    List<String> signalsDetected;
}
