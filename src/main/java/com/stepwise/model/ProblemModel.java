package com.stepwise.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * A curated problem together with its worked solution.
 * <p>
 * The record is bound from the problem library JSON. Every solution step is itself a valid
 * expression or equation, ordered from the first manipulation to the fully simplified answer.
 * </p>
 *
 * @param problemId        Stable identifier used by the shell, e.g. {@code solve-001}.
 * @param title            Short display title.
 * @param problemStatement The starting expression or equation; always the first entry of a learner's history.
 * @param problemType      Whether the learner solves an equation or simplifies an expression.
 * @param solutionSteps    The expected steps. Never empty; the last entry is the final answer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProblemModel(String problemId,
                           String title,
                           String problemStatement,
                           ProblemType problemType,
                           List<String> solutionSteps) {

    /**
     * Compact constructor that rejects problems without a statement or without solution steps.
     * <p>
     * A missing {@code problemType} is inferred from the statement: an {@code =} sign means an
     * equation to solve.
     * </p>
     */
    public ProblemModel {
        if (problemStatement == null || problemStatement.isBlank()) {
            throw new IllegalArgumentException("Problem '" + problemId + "' has no statement");
        }
        if (solutionSteps == null || solutionSteps.isEmpty()) {
            throw new IllegalArgumentException("Problem '" + problemId + "' has no solution steps");
        }
        solutionSteps = List.copyOf(solutionSteps);
        if (problemType == null) {
            problemType = problemStatement.contains("=") ? ProblemType.SOLVE_EQUATION : ProblemType.SIMPLIFY_EXPRESSION;
        }
        if (title == null || title.isBlank()) {
            title = Objects.requireNonNullElse(problemId, problemStatement);
        }
    }

    /**
     * Convenience factory for problems built in code rather than loaded from the library.
     */
    public static ProblemModel of(String problemStatement, List<String> solutionSteps) {
        return new ProblemModel(null, null, problemStatement, null, solutionSteps);
    }

    @JsonIgnore
    public String finalStep() {
        return solutionSteps.get(solutionSteps.size() - 1);
    }

    @JsonIgnore
    public Difficulty difficulty() {
        return Difficulty.forStepCount(solutionSteps.size());
    }
}
