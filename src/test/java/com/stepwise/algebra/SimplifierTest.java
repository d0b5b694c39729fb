package com.stepwise.algebra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SimplifierTest {

    private final Simplifier simplifier = new Simplifier();

    private String simplify(String text) {
        return simplifier.simplify(ExpressionParser.parse(text)).toString();
    }

    private String expand(String text) {
        return simplifier.expand(ExpressionParser.parse(text)).toString();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "3x + 2x + 5     | 5x + 5",
            "3(x + 1)        | 3x + 3",
            "9/3             | 3",
            "6/4             | 3 / 2",
            "2x/2            | x",
            "x/x             | 1",
            "x - x           | 0",
            "0.5x            | x / 2",
            "2 + 3x          | 3x + 2",
            "9 - 3x          | -3x + 9",
            "4(x - 3) - (x - 5) | 3x - 7",
            "x * x           | x^2",
            "sqrt(16) + abs(-3) | 7",
            "3(x - 2y) + 2(y + 4x) | 11x - 4y"
    })
    @DisplayName("simplify folds constants, combines like terms and distributes numeric factors")
    void testSimplify(String input, String expected) {
        assertThat(simplify(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("simplify leaves a variable times a sum unexpanded")
    void testSimplifyKeepsVariableProducts() {
        assertThat(simplify("x(x + 1)")).isEqualTo("x * (x + 1)");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "x(x + 1)        | x^2 + x",
            "(x + 1)^2       | x^2 + 2x + 1",
            "(x + 1)(x - 1)  | x^2 - 1",
            "2(x + 3) - 6    | 2x"
    })
    @DisplayName("expand multiplies out products and small powers of sums")
    void testExpand(String input, String expected) {
        assertThat(expand(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Reordered inputs simplify to the same tree")
    void testDeterministicOrder() {
        var first = simplifier.simplify(ExpressionParser.parse("5 + y + 2x"));
        var second = simplifier.simplify(ExpressionParser.parse("2x + 5 + y"));

        assertThat(first).isEqualTo(second);
        assertThat(first.toString()).isEqualTo("2x + y + 5");
    }

    @Test
    @DisplayName("Simplifying an already simplified tree changes nothing")
    void testIdempotent() {
        var once = simplifier.simplify(ExpressionParser.parse("2x/3 + 1/2 - x^2"));
        var twice = simplifier.simplify(ExpressionParser.parse(once.toString()));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("Division by a literal zero is kept rather than folded")
    void testDivisionByZeroStaysOpaque() {
        assertThat(simplify("x / 0")).isEqualTo("x / 0");
    }
}
