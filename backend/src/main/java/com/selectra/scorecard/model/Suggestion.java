package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Suggestion {
    String dimension;
    double score;
    SuggestionLevel level;
    String icon;
    String text;
}
