package com.stepwise.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationContextTest {

    private static final ProblemModel PROBLEM = ProblemModel.of("2x = 6", List.of("x = 3"));

    @Test
    @DisplayName("The history must start with the problem statement")
    void testHistoryMustStartWithStatement() {
        assertThatThrownBy(() -> new ValidationContext(PROBLEM, List.of(), "x = 3"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ValidationContext(PROBLEM, List.of("3x = 9"), "x = 3"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2x = 6");
    }

    @Test
    @DisplayName("The context keeps its own copy of the history")
    void testHistoryIsCopied() {
        var history = new ArrayList<>(List.of("2x = 6"));
        var context = new ValidationContext(PROBLEM, history, null);

        history.add("x = 3");

        assertThat(context.userHistory()).containsExactly("2x = 6");
        assertThat(context.previousStep()).isEqualTo("2x = 6");
        assertThat(context.studentInput()).isEmpty();
    }
}
