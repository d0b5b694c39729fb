package com.stepwise.shell;

import com.stepwise.model.ProblemModel;
import com.stepwise.model.ProblemType;
import com.stepwise.service.api.PracticeSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShellPromptConfigurationTest {

    @Mock private PracticeSessionService practiceSessionService;

    @Test
    @DisplayName("The prompt shows only the application name when no problem is active")
    void testIdlePrompt() {
        when(practiceSessionService.getCurrentProblem()).thenReturn(Optional.empty());

        assertThat(ShellPromptConfiguration.promptFor(practiceSessionService).toString()).isEqualTo("stepwise > ");
    }

    @Test
    @DisplayName("The prompt names the active problem")
    void testActiveProblemPrompt() {
        var problem = new ProblemModel("solve-002", "Solve for x", "5x + 3 = 2x + 12",
                ProblemType.SOLVE_EQUATION, List.of("x = 3"));
        when(practiceSessionService.getCurrentProblem()).thenReturn(Optional.of(problem));

        assertThat(ShellPromptConfiguration.promptFor(practiceSessionService).toString())
                .isEqualTo("stepwise [solve-002] > ");
    }
}
