package com.stepwise.service.impl;

import com.stepwise.algebra.ExpressionParser;
import com.stepwise.model.PatternKind;
import com.stepwise.model.SimplificationPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PatternDetectorImplTest {

    private PatternDetectorImpl patternDetector;

    @BeforeEach
    void setUp() {
        patternDetector = new PatternDetectorImpl(new InputSyntaxValidatorImpl(), new AlgebraBackendImpl());
    }

    @Test
    @DisplayName("analyze should report reducible constant arithmetic with its result")
    void testConstantArithmetic() {
        var result = patternDetector.analyze("x = 9/3");

        assertThat(result.isFullySimplified()).isFalse();
        assertThat(result.hasUnsimplifiedOperations()).isTrue();
        assertThat(result.patternKinds()).containsExactly(PatternKind.CONSTANT_ARITHMETIC);
        assertThat(patternDetector.feedbackFor(result.patterns()))
                .containsExactly("You can simplify the arithmetic: 9 / 3 becomes 3");
    }

    @Test
    @DisplayName("analyze should report separate constant terms of a sum")
    void testSeparateConstantTerms() {
        var result = patternDetector.analyze("2x + 3 + 5");

        assertThat(result.patterns()).singleElement()
                .satisfies(pattern -> {
                    assertThat(pattern.kind()).isEqualTo(PatternKind.CONSTANT_ARITHMETIC);
                    assertThat(pattern.description()).isEqualTo("Separate constant terms: 3 + 5");
                    assertThat(pattern.suggestionText()).isEqualTo("3 + 5 becomes 8");
                    assertThat(pattern.affectedNodes()).hasSize(2);
                });
        assertThat(result.isFullySimplified()).isFalse();
    }

    @Test
    @DisplayName("analyze should report a constant-only sum once")
    void testConstantSumReportedOnce() {
        var result = patternDetector.analyze("3 + 5 + x");

        assertThat(result.patternKinds()).containsExactly(PatternKind.CONSTANT_ARITHMETIC);
    }

    @Test
    @DisplayName("analyze should report like terms on each side of an equation")
    void testLikeTerms() {
        var result = patternDetector.analyze("3x + 2x = 10");

        assertThat(result.patternKinds()).containsExactly(PatternKind.LIKE_TERMS);
        assertThat(result.patterns().get(0).feedback()).isEqualTo("You can combine like terms: 3x + 2x");
        assertThat(result.hasUnsimplifiedOperations()).isFalse();
        assertThat(result.isFullySimplified()).isFalse();
    }

    @Test
    @DisplayName("analyze should report a number multiplying a bracketed sum")
    void testDistributive() {
        var result = patternDetector.analyze("3(x + 2) = 12");

        assertThat(result.patternKinds()).containsExactly(PatternKind.DISTRIBUTIVE);
        assertThat(result.patterns().get(0).feedback())
                .isEqualTo("You can use the distributive property: multiply out 3(x + 2)");
    }

    @Test
    @DisplayName("analyze should report a coefficient of one")
    void testCoefficientNormalization() {
        var result = patternDetector.analyze("1x + 2");

        assertThat(result.patternKinds()).containsExactly(PatternKind.COEFFICIENT_NORMALIZATION);
        assertThat(result.patterns().get(0).suggestionText()).isEqualTo("write 1x as x");
        assertThat(result.hasUnsimplifiedOperations()).isTrue();
    }

    @Test
    @DisplayName("analyze should find nothing in a simplified answer")
    void testSimplifiedAnswer() {
        var result = patternDetector.analyze("x = 3");

        assertThat(result.patterns()).isEmpty();
        assertThat(result.hasUnsimplifiedOperations()).isFalse();
        assertThat(result.isFullySimplified()).isTrue();
    }

    @Test
    @DisplayName("analyze should treat an irreducible fraction as simplified")
    void testIrreducibleFraction() {
        assertThat(patternDetector.analyze("x = 2/3").isFullySimplified()).isTrue();
    }

    @Test
    @DisplayName("analyze should return the conservative empty result for malformed input")
    void testMalformedInput() {
        var result = patternDetector.analyze("3x ++ 5");

        assertThat(result.patterns()).isEmpty();
        assertThat(result.isFullySimplified()).isFalse();
        assertThat(result.hasUnsimplifiedOperations()).isFalse();
    }

    @Test
    @DisplayName("likeTerms should group products by their variable factors")
    void testLikeTermSignatures() {
        var patterns = patternDetector.likeTerms(ExpressionParser.parse("2xy + 3yx - x + x/2"));

        assertThat(patterns).extracting(SimplificationPattern::description)
                .containsExactly("Like terms with variable part: x*y", "Like terms with variable part: x");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "8x        | true",
            "2x + 3    | true",
            "3 + 2x    | true",
            "x = 3     | true",
            "3x + 5x   | false",
            "0.5x      | false",
            "x = 9/3   | false",
            "3x ++ 5   | false"
    })
    @DisplayName("isFullySimplified should compare the input with its simplified text")
    void testIsFullySimplified(String input, boolean expected) {
        assertThat(patternDetector.isFullySimplified(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("sortedTerms should split at top-level signs only")
    void testSortedTerms() {
        assertThat(PatternDetectorImpl.sortedTerms("3x-2+y")).containsExactly("+3x", "+y", "-2");
        assertThat(PatternDetectorImpl.sortedTerms("3+2(x-1)")).containsExactly("+2(x-1)", "+3");
        assertThat(PatternDetectorImpl.sortedTerms("x^-2+1")).containsExactly("+1", "+x^-2");
    }
}
