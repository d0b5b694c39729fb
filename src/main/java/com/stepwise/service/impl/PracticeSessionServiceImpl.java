package com.stepwise.service.impl;

import com.stepwise.model.ProblemModel;
import com.stepwise.model.StepValidationResult;
import com.stepwise.model.ValidationContext;
import com.stepwise.service.api.HintService;
import com.stepwise.service.api.PracticeSessionService;
import com.stepwise.service.api.ProblemLibraryService;
import com.stepwise.service.api.StepValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of {@link PracticeSessionService} for a single learner.
 * <p>
 * The history starts with the problem statement. A fresh {@link ValidationContext} is built from it
 * for every call into the {@link StepValidator}; only inputs whose result says to advance are
 * appended.
 * </p>
 */
@Service
public class PracticeSessionServiceImpl implements PracticeSessionService {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionServiceImpl.class);

    private final ProblemLibraryService problemLibraryService;
    private final StepValidator stepValidator;
    private final HintService hintService;

    // Mutable state
    private ProblemModel currentProblem;
    private final List<String> history = new ArrayList<>();

    public PracticeSessionServiceImpl(ProblemLibraryService problemLibraryService,
                                      StepValidator stepValidator,
                                      HintService hintService) {
        this.problemLibraryService = problemLibraryService;
        this.stepValidator = stepValidator;
        this.hintService = hintService;
    }

    @Override
    public ProblemModel startProblem(String problemId) {
        var problem = problemLibraryService.findById(problemId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown problem '" + problemId + "'"));

        log.info("Starting problem {}: {}", problem.problemId(), problem.problemStatement());
        this.currentProblem = problem;
        history.clear();
        history.add(problem.problemStatement());
        return problem;
    }

    @Override
    public Optional<ProblemModel> getCurrentProblem() {
        return Optional.ofNullable(currentProblem);
    }

    @Override
    public StepValidationResult submitStep(String input) {
        var result = stepValidator.validateStep(contextFor(input));
        if (result.shouldAdvance()) {
            history.add(input.trim());
        }
        log.info("Step '{}' on {} classified as {}", input, currentProblem.problemId(), result.result());
        return result;
    }

    @Override
    public List<String> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public boolean isSolved() {
        if (currentProblem == null || history.size() <= 1) {
            return false;
        }
        return stepValidator.isProblemSolved(contextFor(""));
    }

    @Override
    public List<String> getExpectedNextSteps() {
        if (currentProblem == null) {
            return List.of();
        }
        return stepValidator.getExpectedNextSteps(contextFor(""));
    }

    @Override
    public List<String> getHints(String input) {
        if (input == null || input.isBlank()) {
            var context = contextFor("");
            return hintService.generateContextualHints(contextFor(context.previousStep()));
        }
        return hintService.generateContextualHints(contextFor(input));
    }

    @Override
    public String getStatus() {
        if (currentProblem == null) {
            return "No problem in progress. Use 'start' to begin.";
        }

        int accepted = history.size() - 1;
        if (isSolved()) {
            return "You have solved %s '%s' in %d step(s)!".formatted(
                    currentProblem.problemId(), currentProblem.problemStatement(), accepted);
        }

        return "Problem: %s '%s' | Difficulty: %s | Steps accepted: %d | Steps remaining: %d.".formatted(
                currentProblem.problemId(), currentProblem.problemStatement(),
                currentProblem.difficulty().label(), accepted, getExpectedNextSteps().size());
    }

    @Override
    public void reset() {
        log.info("Resetting practice session");
        this.currentProblem = null;
        history.clear();
    }

    private ValidationContext contextFor(String input) {
        if (currentProblem == null) {
            throw new IllegalStateException("No active problem. Please start a problem first.");
        }
        return new ValidationContext(currentProblem, history, input);
    }
}
