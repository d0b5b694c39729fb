package com.stepwise.service.impl;

import com.stepwise.exception.MathParsingException;
import com.stepwise.exception.ParsingErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputSyntaxValidatorImplTest {

    private final InputSyntaxValidatorImpl validator = new InputSyntaxValidatorImpl();

    @Test
    @DisplayName("validate should split an equation into trimmed sides")
    void testValidateEquation() {
        var parsed = validator.validate("  3x + 3 =  12 ");

        assertThat(parsed.isEquation()).isTrue();
        assertThat(parsed.trimmed()).isEqualTo("3x + 3 =  12");
        assertThat(parsed.leftSide()).isEqualTo("3x + 3");
        assertThat(parsed.rightSide()).isEqualTo("12");
    }

    @Test
    @DisplayName("validate should accept a plain expression")
    void testValidateExpression() {
        var parsed = validator.validate("4x - x - 7");

        assertThat(parsed.isEquation()).isFalse();
        assertThat(parsed.trimmed()).isEqualTo("4x - x - 7");
        assertThat(parsed.leftSide()).isNull();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    @DisplayName("validate should reject empty input")
    void testEmptyInput(String input) {
        assertThatThrownBy(() -> validator.validate(input))
                .isInstanceOf(MathParsingException.class)
                .hasMessage("Empty input provided")
                .satisfies(e -> assertThat(((MathParsingException) e).getKind()).isEqualTo(ParsingErrorKind.EMPTY_INPUT));
    }

    @ParameterizedTest
    @ValueSource(strings = {"3x ++ 5", "3x + + 5", "x ** 2", "6 // 2", "x --- 1"})
    @DisplayName("validate should reject doubled operators even when separated by spaces")
    void testDoubledOperators(String input) {
        assertThatThrownBy(() -> validator.validate(input))
                .isInstanceOf(MathParsingException.class)
                .hasMessage("Invalid mathematical expression: consecutive operators detected");
    }

    @Test
    @DisplayName("validate should let a double negation through")
    void testDoubleNegationAllowed() {
        assertThat(validator.validate("x - -3").trimmed()).isEqualTo("x - -3");
    }

    @ParameterizedTest
    @ValueSource(strings = {"x = 3 = 3", "x == 3"})
    @DisplayName("validate should reject more than one equals sign")
    void testTooManyEqualsSigns(String input) {
        assertThatThrownBy(() -> validator.validate(input))
                .isInstanceOf(MathParsingException.class)
                .hasMessage("Invalid equation format: equations must have exactly one equals sign")
                .satisfies(e -> assertThat(((MathParsingException) e).getOriginalInput()).isEqualTo(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"= 5", "3x =", " = "})
    @DisplayName("validate should reject an equation with an empty side")
    void testEmptySide(String input) {
        assertThatThrownBy(() -> validator.validate(input))
                .isInstanceOf(MathParsingException.class)
                .hasMessage("Invalid equation format: both sides of equation must contain expressions")
                .satisfies(e -> assertThat(((MathParsingException) e).getKind())
                        .isEqualTo(ParsingErrorKind.INVALID_EQUATION_FORMAT));
    }
}
