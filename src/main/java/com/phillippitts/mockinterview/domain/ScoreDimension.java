package com.phillippitts.mockinterview.domain;

/** Measured scoring dimensions reported by the backend, each on a 0-10 scale. */
public enum ScoreDimension {
    COMMUNICATION("Communication"),
    TECHNICAL("Technical"),
    PROBLEM_SOLVING("Problem Solving"),
    BEHAVIORAL("Body Language");

    private final String label;

    ScoreDimension(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
