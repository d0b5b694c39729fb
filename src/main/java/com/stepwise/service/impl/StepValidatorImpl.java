package com.stepwise.service.impl;

import com.stepwise.algebra.AlgebraParseException;
import com.stepwise.exception.MathParsingException;
import com.stepwise.exception.ParsingErrorKind;
import com.stepwise.model.OperationType;
import com.stepwise.model.OutcomeCode;
import com.stepwise.model.ParsedInput;
import com.stepwise.model.PatternKind;
import com.stepwise.model.StepOperation;
import com.stepwise.model.StepValidationResult;
import com.stepwise.model.TreeAnalysisResult;
import com.stepwise.model.ValidationContext;
import com.stepwise.service.api.AlgebraBackend;
import com.stepwise.service.api.EquivalenceChecker;
import com.stepwise.service.api.InputSyntaxValidator;
import com.stepwise.service.api.PatternDetector;
import com.stepwise.service.api.StepValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Default {@link StepValidator}.
 * <p>
 * Besides the syntax pre-check, the input must be readable by the algebra backend; a backend parse
 * failure is reported as {@code PARSING_ERROR} instead of surfacing later as an equivalence failure.
 * </p>
 */
@Service
public class StepValidatorImpl implements StepValidator {

    private static final Logger log = LoggerFactory.getLogger(StepValidatorImpl.class);

    static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred during validation";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final InputSyntaxValidator inputSyntaxValidator;
    private final AlgebraBackend algebraBackend;
    private final EquivalenceChecker equivalenceChecker;
    private final PatternDetector patternDetector;

    public StepValidatorImpl(InputSyntaxValidator inputSyntaxValidator,
                             AlgebraBackend algebraBackend,
                             EquivalenceChecker equivalenceChecker,
                             PatternDetector patternDetector) {
        this.inputSyntaxValidator = inputSyntaxValidator;
        this.algebraBackend = algebraBackend;
        this.equivalenceChecker = equivalenceChecker;
        this.patternDetector = patternDetector;
    }

    @Override
    public StepValidationResult validateStep(ValidationContext context) {
        String input = context.studentInput();
        try {
            requireReadable(inputSyntaxValidator.validate(input), input);

            TreeAnalysisResult analysis = patternDetector.analyze(input);
            List<String> feedback = patternDetector.feedbackFor(analysis.patterns());
            List<String> steps = context.problemModel().solutionSteps();

            boolean correct = steps.stream().anyMatch(step -> equivalenceChecker.areEquivalent(input, step));

            if (isNoProgress(input, context.previousStep(), correct)) {
                return classified(input, OutcomeCode.VALID_BUT_NO_PROGRESS, analysis, feedback);
            }

            if (correct) {
                int index = matchingStepIndex(input, steps);
                if (index == steps.size() - 1) {
                    return analysis.isFullySimplified()
                            ? classified(input, OutcomeCode.CORRECT_FINAL_STEP, analysis, List.of())
                            : classified(input, OutcomeCode.CORRECT_BUT_NOT_SIMPLIFIED, analysis, feedback);
                }
                return classified(input, OutcomeCode.CORRECT_INTERMEDIATE_STEP, analysis,
                        analysis.isFullySimplified() ? List.of() : feedback);
            }

            return classified(input, OutcomeCode.EQUIVALENCE_FAILURE, analysis, feedback);
        } catch (MathParsingException e) {
            log.debug("Rejected '{}' ({}): {}", input, e.getKind(), e.getMessage());
            return StepValidationResult.parsingError(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while validating '{}'", input, e);
            return StepValidationResult.parsingError(UNEXPECTED_ERROR_MESSAGE);
        }
    }

    @Override
    public boolean isProblemSolved(ValidationContext context) {
        try {
            String lastStep = context.previousStep();
            String finalStep = context.problemModel().finalStep();
            return equivalenceChecker.areEquivalent(lastStep, finalStep)
                    && patternDetector.analyze(lastStep).isFullySimplified();
        } catch (RuntimeException e) {
            log.warn("Could not check whether the problem is solved: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> getExpectedNextSteps(ValidationContext context) {
        List<String> steps = context.problemModel().solutionSteps();
        if (context.userHistory().size() <= 1) {
            return steps;
        }
        int furthest = -1;
        for (String entry : context.userHistory().subList(1, context.userHistory().size())) {
            furthest = Math.max(furthest, furthestStepIndex(entry, steps));
        }
        return steps.subList(furthest + 1, steps.size());
    }

    @Override
    public StepOperation analyzeStepOperation(String previousStep, String currentStep) {
        try {
            if (previousStep.trim().equals(currentStep.trim())) {
                return StepOperation.of(OperationType.NO_CHANGE, false);
            }
            List<PatternKind> before = patternDetector.analyze(previousStep).patternKinds();
            List<PatternKind> after = patternDetector.analyze(currentStep).patternKinds();

            if (removed(PatternKind.CONSTANT_ARITHMETIC, before, after)) {
                return StepOperation.of(OperationType.SIMPLIFIED_ARITHMETIC, true);
            }
            if (removed(PatternKind.LIKE_TERMS, before, after)) {
                return StepOperation.of(OperationType.COMBINED_LIKE_TERMS, true);
            }
            if (removed(PatternKind.DISTRIBUTIVE, before, after)) {
                return StepOperation.of(OperationType.DISTRIBUTED, true);
            }
            if (equivalenceChecker.areEquivalent(previousStep, currentStep)) {
                return StepOperation.of(OperationType.EQUIVALENT_TRANSFORMATION, true);
            }
            return textualOperation(previousStep.trim(), currentStep.trim());
        } catch (RuntimeException e) {
            log.warn("Could not analyse the operation from '{}' to '{}': {}", previousStep, currentStep, e.getMessage());
            return StepOperation.of(OperationType.ERROR, false);
        }
    }

    /**
     * A verbatim repeat is never progress. An equivalent rewrite of the previous step that is not
     * itself an expected step is progress only if it removes at least one simplification opportunity.
     */
    private boolean isNoProgress(String input, String previousStep, boolean correct) {
        if (input.trim().equals(previousStep.trim())) {
            return true;
        }
        if (correct || !equivalenceChecker.areEquivalent(input, previousStep)) {
            return false;
        }
        int current = patternDetector.analyze(input).patterns().size();
        int previous = patternDetector.analyze(previousStep).patterns().size();
        return current >= previous;
    }

    /**
     * Rough guess for steps that are not equivalent, e.g. dividing both sides of an equation.
     */
    private static StepOperation textualOperation(String previous, String current) {
        if (current.length() > previous.length()) {
            return StepOperation.of(OperationType.EXPANSION, true);
        }
        if (current.length() < previous.length()) {
            return StepOperation.of(OperationType.SIMPLIFICATION, true);
        }
        if (introduces("+", previous, current)) {
            return StepOperation.of(OperationType.ADDITION, true);
        }
        if (introduces("-", previous, current)) {
            return StepOperation.of(OperationType.SUBTRACTION, true);
        }
        if (introduces("*", previous, current)) {
            return StepOperation.of(OperationType.MULTIPLICATION, true);
        }
        if (introduces("/", previous, current)) {
            return StepOperation.of(OperationType.DIVISION, true);
        }
        return StepOperation.of(OperationType.UNKNOWN, false);
    }

    private static boolean introduces(String operator, String previous, String current) {
        return current.contains(operator) && !previous.contains(operator);
    }

    /**
     * Each side must be readable by the algebra backend, not only pass the syntax pre-check.
     */
    private void requireReadable(ParsedInput parsed, String input) {
        List<String> sides = parsed.isEquation()
                ? List.of(parsed.leftSide(), parsed.rightSide())
                : List.of(parsed.trimmed());
        for (String side : sides) {
            try {
                algebraBackend.parse(side);
            } catch (AlgebraParseException e) {
                throw new MathParsingException(ParsingErrorKind.BACKEND_PARSE_FAILURE,
                        "Failed to parse mathematical expression: " + e.getMessage(), input, e);
            }
        }
    }

    /**
     * @return The index of the step with the same text as {@code entry} ignoring whitespace, else the last
     * step equivalent to it, else -1.
     */
    private int furthestStepIndex(String entry, List<String> steps) {
        int exact = exactStepIndex(entry, steps);
        if (exact >= 0) {
            return exact;
        }
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (equivalenceChecker.areEquivalent(entry, steps.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int exactStepIndex(String input, List<String> steps) {
        String compact = compact(input);
        for (int i = 0; i < steps.size(); i++) {
            if (compact(steps.get(i)).equals(compact)) {
                return i;
            }
        }
        return -1;
    }

    private static String compact(String text) {
        return WHITESPACE.matcher(text).replaceAll("");
    }

    /**
     * @return The index of the step matching {@code input} by text ignoring whitespace, else the first
     * equivalent step, else -1.
     */
    private int matchingStepIndex(String input, List<String> steps) {
        int exact = exactStepIndex(input, steps);
        if (exact >= 0) {
            return exact;
        }
        for (int i = 0; i < steps.size(); i++) {
            if (equivalenceChecker.areEquivalent(input, steps.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean removed(PatternKind kind, List<PatternKind> before, List<PatternKind> after) {
        return before.contains(kind) && !after.contains(kind);
    }

    private StepValidationResult classified(String input, OutcomeCode outcome, TreeAnalysisResult analysis, List<String> feedback) {
        log.debug("Classified '{}' as {}", input.trim(), outcome);
        return StepValidationResult.of(outcome, analysis, feedback);
    }
}
