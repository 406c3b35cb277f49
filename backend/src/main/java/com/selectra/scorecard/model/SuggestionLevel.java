package com.selectra.scorecard.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.selectra.scorecard.rubric.ThresholdTable;

public enum SuggestionLevel {

    LOW("low", "warning"),
    MEDIUM("medium", "tip"),
    HIGH("high", "check");

    private final String key;
    private final String icon;

    SuggestionLevel(String key, String icon) {
        this.key = key;
        this.icon = icon;
    }

    // closed on the upper side: 3.0 is still low, 6.0 still medium
    private static final ThresholdTable<SuggestionLevel> BANDS = ThresholdTable.<SuggestionLevel>builder()
            .above(6, HIGH)
            .above(3, MEDIUM)
            .otherwise(LOW);

    public static SuggestionLevel forScore(double score) {
        return BANDS.lookup(score);
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getIcon() {
        return icon;
    }
}
