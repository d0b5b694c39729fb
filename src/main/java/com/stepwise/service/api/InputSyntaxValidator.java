package com.stepwise.service.api;

import com.stepwise.exception.MathParsingException;
import com.stepwise.model.ParsedInput;

/**
 * Cheap pre-check on raw learner input, run before anything reaches the algebra backend.
 */
public interface InputSyntaxValidator {

    /**
     * Trims the input, rejects obvious typos and splits an equation into its two sides.
     *
     * @param input The raw text as typed.
     * @return The trimmed input, split into sides if it is an equation.
     * @throws MathParsingException with {@code EMPTY_INPUT}, {@code MALFORMED_EXPRESSION} or
     *                              {@code INVALID_EQUATION_FORMAT}.
     */
    ParsedInput validate(String input);
}
