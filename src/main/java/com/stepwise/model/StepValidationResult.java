package com.stepwise.model;

import java.util.List;
import java.util.Objects;

/**
 * Classification of one submitted step.
 * <p>
 * {@code isCorrect} and {@code shouldAdvance} always mirror {@link OutcomeCode#isCorrect()}; use the
 * factories rather than the canonical constructor. A {@code PARSING_ERROR} carries an
 * {@code errorMessage} and no analysis; every other outcome carries the analysis of the input.
 * </p>
 *
 * @param result                 The outcome.
 * @param isCorrect              The input matches one of the expected steps.
 * @param shouldAdvance          The input should be appended to the learner's history.
 * @param errorMessage           Why the input could not be read, or {@code null}.
 * @param treeAnalysis           Pattern analysis of the input, or {@code null} for parsing errors.
 * @param simplificationFeedback One learner-facing sentence per detected pattern.
 * @param detectedPatternKinds   The kind of every detected pattern, in the same order.
 */
public record StepValidationResult(OutcomeCode result,
                                   boolean isCorrect,
                                   boolean shouldAdvance,
                                   String errorMessage,
                                   TreeAnalysisResult treeAnalysis,
                                   List<String> simplificationFeedback,
                                   List<PatternKind> detectedPatternKinds) {

    public StepValidationResult {
        Objects.requireNonNull(result, "result");
        if (isCorrect != result.isCorrect() || shouldAdvance != result.isCorrect()) {
            throw new IllegalArgumentException("Flags do not match outcome " + result);
        }
        simplificationFeedback = simplificationFeedback == null ? List.of() : List.copyOf(simplificationFeedback);
        detectedPatternKinds = detectedPatternKinds == null ? List.of() : List.copyOf(detectedPatternKinds);
    }

    public static StepValidationResult of(OutcomeCode result, TreeAnalysisResult treeAnalysis, List<String> feedback) {
        return new StepValidationResult(result, result.isCorrect(), result.isCorrect(), null,
                treeAnalysis, feedback, treeAnalysis.patternKinds());
    }

    public static StepValidationResult parsingError(String errorMessage) {
        return new StepValidationResult(OutcomeCode.PARSING_ERROR, false, false, errorMessage, null, List.of(), List.of());
    }
}
