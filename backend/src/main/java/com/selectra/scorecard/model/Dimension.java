package com.selectra.scorecard.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Dimension {

    CLARITY("clarity", "Clarity"),
    ACCURACY("accuracy", "Technical Accuracy"),
    COMPLETENESS("completeness", "Completeness"),
    CONFIDENCE("confidence", "Confidence");

    private final String key;
    private final String label;

    Dimension(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }
}
