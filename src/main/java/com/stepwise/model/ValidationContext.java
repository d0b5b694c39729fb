package com.stepwise.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything the step validator needs for one call.
 * <p>
 * Built fresh for every validation and immutable for its duration. The history always starts with
 * the problem statement; every later entry is a step that was accepted earlier.
 * </p>
 *
 * @param problemModel The problem being worked on.
 * @param userHistory  The problem statement followed by the accepted steps, oldest first.
 * @param studentInput The new submission.
 */
public record ValidationContext(ProblemModel problemModel, List<String> userHistory, String studentInput) {

    public ValidationContext {
        Objects.requireNonNull(problemModel, "problemModel");
        Objects.requireNonNull(userHistory, "userHistory");
        if (userHistory.isEmpty()) {
            throw new IllegalArgumentException("History must start with the problem statement");
        }
        if (!userHistory.get(0).trim().equals(problemModel.problemStatement().trim())) {
            throw new IllegalArgumentException(
                    "History must start with the problem statement '" + problemModel.problemStatement() + "'");
        }
        userHistory = List.copyOf(userHistory);
        studentInput = studentInput == null ? "" : studentInput;
    }

    /**
     * Context for the first submission on a problem.
     */
    public static ValidationContext firstStep(ProblemModel problemModel, String studentInput) {
        return new ValidationContext(problemModel, List.of(problemModel.problemStatement()), studentInput);
    }

    public String previousStep() {
        return userHistory.get(userHistory.size() - 1);
    }
}
