package com.stepwise.algebra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionParserTest {

    private static final Symbol X = new Symbol("x");
    private static final Symbol Y = new Symbol("y");

    @Test
    @DisplayName("A coefficient next to a variable is an implicit multiplication")
    void testImplicitMultiplication() {
        assertThat(ExpressionParser.parse("3x"))
                .isEqualTo(Operator.binary(Operator.MULTIPLY, Constant.of(3), X));
        assertThat(ExpressionParser.parse("xy"))
                .isEqualTo(Operator.binary(Operator.MULTIPLY, X, Y));
    }

    @Test
    @DisplayName("Parentheses are kept as nodes of their own")
    void testParenthesesArePreserved() {
        var expected = Operator.binary(Operator.MULTIPLY, Constant.of(2),
                new Parenthesis(Operator.binary(Operator.ADD, X, Constant.ONE)));

        assertThat(ExpressionParser.parse("2(x + 1)")).isEqualTo(expected);
    }

    @Test
    @DisplayName("A minus sign in front of a number literal becomes a negative constant")
    void testNegativeLiteralIsFolded() {
        assertThat(ExpressionParser.parse("-5")).isEqualTo(Constant.of(-5));
        assertThat(ExpressionParser.parse("-x")).isEqualTo(Operator.negate(X));
    }

    @Test
    @DisplayName("Power binds tighter than multiplication and is right-associative")
    void testPowerPrecedence() {
        var expected = Operator.binary(Operator.MULTIPLY, Constant.of(2),
                Operator.binary(Operator.POWER, X, Operator.binary(Operator.POWER, Constant.of(3), Constant.of(2))));

        assertThat(ExpressionParser.parse("2x^3^2")).isEqualTo(expected);
    }

    @Test
    @DisplayName("Known function names are read as functions, not as variables")
    void testFunctions() {
        assertThat(ExpressionParser.parse("sqrt(4)")).isEqualTo(new Operator("sqrt", List.of(Constant.of(4))));
        assertThat(ExpressionParser.parse("2abs(x)"))
                .isEqualTo(Operator.binary(Operator.MULTIPLY, Constant.of(2), new Operator("abs", List.of(X))));
    }

    @Test
    @DisplayName("A number written right after a closing parenthesis multiplies the group")
    void testNumberAfterParenthesis() {
        assertThat(ExpressionParser.parse("(x + 3)2")).isEqualTo(Operator.binary(Operator.MULTIPLY,
                new Parenthesis(Operator.binary(Operator.ADD, X, Constant.of(3))), Constant.of(2)));
        assertThat(ExpressionParser.parse("(x+1)2")).isEqualTo(ExpressionParser.parse("(x + 1) * 2"));
    }

    @Test
    @DisplayName("Decimal literals compare equal regardless of trailing zeros")
    void testDecimals() {
        assertThat(ExpressionParser.parse("2.50")).isEqualTo(ExpressionParser.parse("2.5"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"3x^2 + 2x - 5", "x - (y - 1)", "2(x + 1)", "x * (x + 1)", "-3x + 9", "x / 3 + 1 / 2"})
    @DisplayName("Rendering a parsed tree gives back the canonical spelling")
    void testToStringRoundTrip(String text) {
        var tree = ExpressionParser.parse(text);

        assertThat(tree.toString()).isEqualTo(text);
        assertThat(ExpressionParser.parse(tree.toString())).isEqualTo(tree);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "3x +", "(x + 1", "3 $ 4", "1.2.3", "x + )", "sqrt x"})
    @DisplayName("Malformed input is rejected with a parse exception")
    void testMalformedInput(String text) {
        assertThatThrownBy(() -> ExpressionParser.parse(text))
                .isInstanceOf(AlgebraParseException.class);
    }

    @Test
    @DisplayName("Parse errors report the position of the offending token")
    void testErrorPosition() {
        assertThatThrownBy(() -> ExpressionParser.parse("3 + $"))
                .isInstanceOf(AlgebraParseException.class)
                .satisfies(e -> assertThat(((AlgebraParseException) e).getPosition()).isEqualTo(4));
    }
}
