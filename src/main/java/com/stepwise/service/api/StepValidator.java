package com.stepwise.service.api;

import com.stepwise.model.StepOperation;
import com.stepwise.model.StepValidationResult;
import com.stepwise.model.ValidationContext;

import java.util.List;

/**
 * Classifies a learner's submission against the problem's worked solution and their history.
 * <p>
 * This is the single boundary where parsing failures and unexpected errors become a learner-facing
 * {@code PARSING_ERROR}; every method here is total.
 * </p>
 */
public interface StepValidator {

    /**
     * Classifies {@code context.studentInput()} into one of the six outcome codes.
     * <p>
     * The input is correct if it is equivalent to any solution step. Repeating the previous step
     * verbatim, or rewriting it equivalently without removing any simplification opportunity, is
     * reported as no progress. A correct input matching the last solution step is final only when
     * it is fully simplified.
     * </p>
     *
     * @param context The problem, the accepted history and the new input.
     * @return The classification with the pattern analysis of the input.
     */
    StepValidationResult validateStep(ValidationContext context);

    /**
     * Re-checks the last history entry against the final solution step.
     *
     * @param context The current context; {@code studentInput} is ignored.
     * @return {@code true} if the last accepted step is equivalent to the final answer and fully simplified.
     */
    boolean isProblemSolved(ValidationContext context);

    /**
     * Lists the solution steps after the furthest one any accepted step matches.
     * <p>
     * An accepted step matches the solution step with the same text, ignoring whitespace; failing
     * that, it matches the last solution step it is equivalent to. If nothing matches, or only the
     * problem statement is in the history, every step is returned.
     * </p>
     *
     * @param context The current context; {@code studentInput} is ignored.
     * @return The remaining solution steps, in order.
     */
    List<String> getExpectedNextSteps(ValidationContext context);

    /**
     * Guesses what the learner did between two steps, for hint text only.
     * <p>
     * An unchanged step is {@code NO_CHANGE}. Otherwise a removed simplification pattern names the
     * operation, then equivalence, then a comparison of the two texts.
     * </p>
     *
     * @param previousStep The earlier step.
     * @param currentStep  The later step.
     * @return A best-effort description; never authoritative.
     */
    StepOperation analyzeStepOperation(String previousStep, String currentStep);
}
