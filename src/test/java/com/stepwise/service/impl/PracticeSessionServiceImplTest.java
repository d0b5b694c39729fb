package com.stepwise.service.impl;

import com.stepwise.model.OutcomeCode;
import com.stepwise.model.ProblemModel;
import com.stepwise.model.ProblemType;
import com.stepwise.model.StepValidationResult;
import com.stepwise.model.TreeAnalysisResult;
import com.stepwise.model.ValidationContext;
import com.stepwise.service.api.HintService;
import com.stepwise.service.api.ProblemLibraryService;
import com.stepwise.service.api.StepValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PracticeSessionServiceImplTest {

    private static final ProblemModel PROBLEM = new ProblemModel("solve-004", "Solve for x", "2x + 5 = 11",
            ProblemType.SOLVE_EQUATION, List.of("2x = 11 - 5", "2x = 6", "x = 3"));

    private static final StepValidationResult ACCEPTED = StepValidationResult.of(
            OutcomeCode.CORRECT_INTERMEDIATE_STEP, TreeAnalysisResult.of(List.of(), false), List.of());
    private static final StepValidationResult REJECTED = StepValidationResult.of(
            OutcomeCode.EQUIVALENCE_FAILURE, TreeAnalysisResult.of(List.of(), false), List.of());

    @Mock private ProblemLibraryService problemLibraryService;
    @Mock private StepValidator stepValidator;
    @Mock private HintService hintService;

    private PracticeSessionServiceImpl practiceSession;

    @BeforeEach
    void setUp() {
        practiceSession = new PracticeSessionServiceImpl(problemLibraryService, stepValidator, hintService);
    }

    private void startProblem() {
        when(problemLibraryService.findById("solve-004")).thenReturn(Optional.of(PROBLEM));
        practiceSession.startProblem("solve-004");
    }

    @Test
    @DisplayName("startProblem should make the problem current and seed the history with its statement")
    void testStartProblem() {
        startProblem();

        assertThat(practiceSession.getCurrentProblem()).contains(PROBLEM);
        assertThat(practiceSession.getHistory()).containsExactly("2x + 5 = 11");
    }

    @Test
    @DisplayName("startProblem should throw for an unknown problem")
    void testStartUnknownProblem() {
        when(problemLibraryService.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> practiceSession.startProblem("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown problem 'nope'");
        assertThat(practiceSession.getCurrentProblem()).isEmpty();
    }

    @Test
    @DisplayName("submitStep should append accepted steps to the history, trimmed")
    void testSubmitAcceptedStep() {
        startProblem();
        when(stepValidator.validateStep(any())).thenReturn(ACCEPTED);

        var result = practiceSession.submitStep("  2x = 6 ");

        assertThat(result).isEqualTo(ACCEPTED);
        assertThat(practiceSession.getHistory()).containsExactly("2x + 5 = 11", "2x = 6");

        ArgumentCaptor<ValidationContext> contextCaptor = ArgumentCaptor.forClass(ValidationContext.class);
        verify(stepValidator).validateStep(contextCaptor.capture());
        assertThat(contextCaptor.getValue().userHistory()).containsExactly("2x + 5 = 11");
        assertThat(contextCaptor.getValue().studentInput()).isEqualTo("  2x = 6 ");
    }

    @Test
    @DisplayName("submitStep should leave the history alone for rejected steps")
    void testSubmitRejectedStep() {
        startProblem();
        when(stepValidator.validateStep(any())).thenReturn(REJECTED);

        practiceSession.submitStep("7x = 9");

        assertThat(practiceSession.getHistory()).containsExactly("2x + 5 = 11");
    }

    @Test
    @DisplayName("submitStep should throw when no problem is active")
    void testSubmitWithoutProblem() {
        assertThatThrownBy(() -> practiceSession.submitStep("x = 3"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No active problem. Please start a problem first.");
        verifyNoInteractions(stepValidator);
    }

    @Test
    @DisplayName("isSolved should not ask the validator before any step was accepted")
    void testIsSolvedWithOnlyStatement() {
        startProblem();

        assertThat(practiceSession.isSolved()).isFalse();
        verify(stepValidator, never()).isProblemSolved(any());
    }

    @Test
    @DisplayName("getHints without input should hint on the last accepted step")
    void testHintsOnLastStep() {
        startProblem();
        when(hintService.generateContextualHints(any())).thenReturn(List.of("hint"));

        assertThat(practiceSession.getHints(" ")).containsExactly("hint");

        ArgumentCaptor<ValidationContext> contextCaptor = ArgumentCaptor.forClass(ValidationContext.class);
        verify(hintService).generateContextualHints(contextCaptor.capture());
        assertThat(contextCaptor.getValue().studentInput()).isEqualTo("2x + 5 = 11");
    }

    @Test
    @DisplayName("getStatus should describe progress and the solved state")
    void testGetStatus() {
        assertThat(practiceSession.getStatus()).isEqualTo("No problem in progress. Use 'start' to begin.");

        startProblem();
        when(stepValidator.getExpectedNextSteps(any())).thenReturn(PROBLEM.solutionSteps());
        assertThat(practiceSession.getStatus())
                .isEqualTo("Problem: solve-004 '2x + 5 = 11' | Difficulty: Medium | Steps accepted: 0 | Steps remaining: 3.");

        when(stepValidator.validateStep(any())).thenReturn(ACCEPTED);
        practiceSession.submitStep("x = 3");
        when(stepValidator.isProblemSolved(any())).thenReturn(true);
        assertThat(practiceSession.getStatus()).isEqualTo("You have solved solve-004 '2x + 5 = 11' in 1 step(s)!");
    }

    @Test
    @DisplayName("reset should clear the problem and the history")
    void testReset() {
        startProblem();

        practiceSession.reset();

        assertThat(practiceSession.getCurrentProblem()).isEmpty();
        assertThat(practiceSession.getHistory()).isEmpty();
        assertThat(practiceSession.getExpectedNextSteps()).isEmpty();
    }
}
