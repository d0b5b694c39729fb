package com.stepwise.service.impl;

import com.stepwise.exception.MathParsingException;
import com.stepwise.exception.ParsingErrorKind;
import com.stepwise.model.ParsedInput;
import com.stepwise.service.api.InputSyntaxValidator;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Default {@link InputSyntaxValidator}.
 * <p>
 * The doubled-operator check is a heuristic for common typos, not a grammar. It runs on the input
 * with all whitespace removed, so {@code 3x + + 5} is caught as well. A single {@code --} is let
 * through because it is a valid double negation.
 * </p>
 */
@Service
public class InputSyntaxValidatorImpl implements InputSyntaxValidator {

    private static final Pattern DOUBLED_OPERATORS = Pattern.compile("\\+\\+|---|//|\\*\\*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public ParsedInput validate(String input) {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.isEmpty()) {
            throw new MathParsingException(ParsingErrorKind.EMPTY_INPUT, "Empty input provided", input);
        }

        String compact = WHITESPACE.matcher(trimmed).replaceAll("");
        if (DOUBLED_OPERATORS.matcher(compact).find()) {
            throw new MathParsingException(ParsingErrorKind.MALFORMED_EXPRESSION,
                    "Invalid mathematical expression: consecutive operators detected", input);
        }

        if (!trimmed.contains("=")) {
            return ParsedInput.expression(trimmed);
        }

        String[] sides = trimmed.split("=", -1);
        if (sides.length != 2) {
            throw new MathParsingException(ParsingErrorKind.INVALID_EQUATION_FORMAT,
                    "Invalid equation format: equations must have exactly one equals sign", input);
        }
        String left = sides[0].trim();
        String right = sides[1].trim();
        if (left.isEmpty() || right.isEmpty()) {
            throw new MathParsingException(ParsingErrorKind.INVALID_EQUATION_FORMAT,
                    "Invalid equation format: both sides of equation must contain expressions", input);
        }
        return ParsedInput.equation(trimmed, left, right);
    }
}
