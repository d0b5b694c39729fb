package com.stepwise.exception;

/**
 * Why a learner's input could not be turned into an expression tree.
 */
public enum ParsingErrorKind {
    /** Nothing but whitespace was submitted. */
    EMPTY_INPUT,
    /** Doubled operators such as {@code ++} or {@code //}. */
    MALFORMED_EXPRESSION,
    /** More than one {@code =}, or an empty side of an equation. */
    INVALID_EQUATION_FORMAT,
    /** The algebra backend rejected the text. */
    BACKEND_PARSE_FAILURE
}
