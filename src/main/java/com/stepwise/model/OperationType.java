package com.stepwise.model;

/**
 * What a learner appears to have done between two consecutive steps.
 */
public enum OperationType {
    SIMPLIFIED_ARITHMETIC("Simplified constant arithmetic operations"),
    COMBINED_LIKE_TERMS("Combined like terms"),
    DISTRIBUTED("Applied distributive property"),
    EQUIVALENT_TRANSFORMATION("Applied valid mathematical transformation"),
    NO_CHANGE("No mathematical operation was performed"),
    EXPANSION("Expanded or distributed terms"),
    SIMPLIFICATION("Simplified the expression"),
    ADDITION("Added terms to both sides"),
    SUBTRACTION("Subtracted terms from both sides"),
    MULTIPLICATION("Multiplied both sides"),
    DIVISION("Divided both sides"),
    UNKNOWN("Could not identify the mathematical operation"),
    ERROR("Error analyzing the mathematical operation");

    private final String description;

    OperationType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
