package com.stepwise.algebra;

/**
 * Thrown by {@link ExpressionParser} when text is not a well-formed expression.
 */
public class AlgebraParseException extends RuntimeException {

    private final int position;

    public AlgebraParseException(String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
    }

    /**
     * @return The zero-based character offset at which parsing failed.
     */
    public int getPosition() {
        return position;
    }
}
