package com.stepwise.service.api;

import com.stepwise.model.SimplificationPattern;
import com.stepwise.model.TreeAnalysisResult;

import java.util.List;

/**
 * Finds the parts of a learner's input that could still be simplified.
 * <p>
 * Detection works on the tree exactly as the learner wrote it, not on a simplified version, so
 * that the suggestions point at text the learner can see. None of these methods throw.
 * </p>
 */
public interface PatternDetector {

    /**
     * Analyses an expression, or each side of an equation.
     *
     * @param input The learner's input.
     * @return The detected patterns, or {@link TreeAnalysisResult#empty()} if the input cannot be read.
     */
    TreeAnalysisResult analyze(String input);

    /**
     * Checks whether simplifying the input would change anything beyond spacing, explicit
     * {@code *} signs and the order of terms.
     *
     * @param input An expression or an equation; for an equation both sides must pass.
     * @return {@code true} if the input is already in simplified form; {@code false} otherwise or if
     *         the input cannot be read.
     */
    boolean isFullySimplified(String input);

    /**
     * Turns detected patterns into learner-facing sentences, one per pattern.
     *
     * @param patterns Patterns from {@link #analyze(String)}.
     * @return Sentences such as {@code "You can combine like terms: 3x + 2x"}.
     */
    List<String> feedbackFor(List<SimplificationPattern> patterns);
}
