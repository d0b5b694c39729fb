package com.stepwise.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProblemModelTest {

    @Test
    @DisplayName("A problem needs a statement and at least one solution step")
    void testRequiredFields() {
        assertThatThrownBy(() -> ProblemModel.of(" ", List.of("x = 3")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProblemModel.of("2x = 6", List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no solution steps");
    }

    @Test
    @DisplayName("The problem type is inferred from the statement when absent")
    void testInferredType() {
        assertThat(ProblemModel.of("2x = 6", List.of("x = 3")).problemType()).isEqualTo(ProblemType.SOLVE_EQUATION);
        assertThat(ProblemModel.of("4x - x", List.of("3x")).problemType()).isEqualTo(ProblemType.SIMPLIFY_EXPRESSION);
    }

    @Test
    @DisplayName("finalStep and difficulty come from the solution steps")
    void testDerivedValues() {
        var problem = ProblemModel.of("5x + 3 = 2x + 12",
                List.of("5x - 2x + 3 = 12", "3x + 3 = 12", "3x = 12 - 3", "3x = 9", "x = 3"));

        assertThat(problem.finalStep()).isEqualTo("x = 3");
        assertThat(problem.difficulty()).isEqualTo(Difficulty.HARD);
        assertThat(problem.title()).isEqualTo("5x + 3 = 2x + 12");
    }
}
