package com.stepwise.service.api;

import com.stepwise.model.ProblemModel;
import com.stepwise.model.StepValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Holds the state of one learner working through one problem.
 * <p>
 * This service is the host controller of the validation core. It is responsible for:
 * <ul>
 *   <li>Selecting a problem from the {@link ProblemLibraryService}.</li>
 *   <li>Building a fresh validation context for every submission.</li>
 *   <li>Appending accepted steps to the learner's history.</li>
 *   <li>Answering progress questions (solved, remaining steps, hints).</li>
 * </ul>
 * State is kept in memory only.
 * </p>
 */
public interface PracticeSessionService {

    /**
     * Starts working on a problem, discarding any previous session.
     *
     * @param problemId The identifier of a problem in the library.
     * @return The started problem.
     * @throws IllegalArgumentException if no problem has that identifier.
     */
    ProblemModel startProblem(String problemId);

    /**
     * @return The problem in progress, or empty if none has been started.
     */
    Optional<ProblemModel> getCurrentProblem();

    /**
     * Validates a step and, if it is correct, appends it to the history.
     *
     * @param input The learner's step.
     * @return The validation result.
     * @throws IllegalStateException if no problem has been started.
     */
    StepValidationResult submitStep(String input);

    /**
     * @return The problem statement followed by every accepted step; empty without an active problem.
     */
    List<String> getHistory();

    /**
     * @return {@code true} if the last accepted step is the simplified final answer.
     */
    boolean isSolved();

    /**
     * @return The solution steps still ahead of the learner; empty without an active problem.
     */
    List<String> getExpectedNextSteps();

    /**
     * Builds hints for an input, or for the last accepted step when {@code input} is blank.
     *
     * @param input The expression or equation to hint on, may be {@code null}.
     * @return The hints.
     * @throws IllegalStateException if no problem has been started.
     */
    List<String> getHints(String input);

    /**
     * @return A one-line, human-readable summary of the session.
     */
    String getStatus();

    /**
     * Forgets the current problem and history.
     */
    void reset();
}
