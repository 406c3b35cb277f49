package com.selectra.scorecard.model;

import com.fasterxml.jackson.annotation.JsonFormat;

@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum ReadinessTier {

    STRONG_CANDIDATE("Strong Candidate", "high",
            "Demonstrates excellent interview skills across all dimensions.",
            "readiness-high"),
    INTERVIEW_READY("Interview Ready", "medium",
            "Solid performance with room for targeted improvement.",
            "readiness-medium"),
    NEEDS_PREPARATION("Needs Preparation", "low",
            "Additional practice recommended before proceeding to interviews.",
            "readiness-low");

    private final String label;
    private final String level;
    private final String description;
    private final String className;

    ReadinessTier(String label, String level, String description, String className) {
        this.label = label;
        this.level = level;
        this.description = description;
        this.className = className;
    }

    public String getLabel() {
        return label;
    }

    public String getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public String getClassName() {
        return className;
    }
}
