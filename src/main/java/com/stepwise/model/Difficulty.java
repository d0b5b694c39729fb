package com.stepwise.model;

/**
 * Difficulty band of a problem, derived from the length of its worked solution.
 */
public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Difficulty forStepCount(int steps) {
        if (steps <= 2) {
            return EASY;
        }
        return steps <= 4 ? MEDIUM : HARD;
    }
}
