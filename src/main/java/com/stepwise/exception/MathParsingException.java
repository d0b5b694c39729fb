package com.stepwise.exception;

/**
 * Typed failure raised by the input validator and the canonicalizer.
 * <p>
 * The step validator is the only component that catches this exception and turns it into a
 * learner-facing {@code PARSING_ERROR} outcome; the message is written to be shown as is.
 * </p>
 */
public class MathParsingException extends RuntimeException {

    private final ParsingErrorKind kind;
    private final String originalInput;

    public MathParsingException(ParsingErrorKind kind, String message, String originalInput) {
        this(kind, message, originalInput, null);
    }

    public MathParsingException(ParsingErrorKind kind, String message, String originalInput, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.originalInput = originalInput;
    }

    public ParsingErrorKind getKind() {
        return kind;
    }

    /**
     * @return The input exactly as it was submitted, before trimming.
     */
    public String getOriginalInput() {
        return originalInput;
    }
}
