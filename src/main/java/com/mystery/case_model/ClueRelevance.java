package com.mystery.case_model;

/**
 * How strongly a clue points at the solution
 */
public enum ClueRelevance {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    ClueRelevance(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
