package com.stepwise.model;

/**
 * Result of the syntax pre-check on a learner's input.
 *
 * @param trimmed    The input without surrounding whitespace.
 * @param isEquation {@code true} if the input has the form {@code LHS = RHS}.
 * @param leftSide   The trimmed left-hand side, or {@code null} for a plain expression.
 * @param rightSide  The trimmed right-hand side, or {@code null} for a plain expression.
 */
public record ParsedInput(String trimmed, boolean isEquation, String leftSide, String rightSide) {

    public static ParsedInput expression(String trimmed) {
        return new ParsedInput(trimmed, false, null, null);
    }

    public static ParsedInput equation(String trimmed, String leftSide, String rightSide) {
        return new ParsedInput(trimmed, true, leftSide, rightSide);
    }
}
