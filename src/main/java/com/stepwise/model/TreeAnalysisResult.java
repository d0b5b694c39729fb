package com.stepwise.model;

import java.util.List;

/**
 * Outcome of analysing one input for simplification opportunities.
 * <p>
 * {@code isFullySimplified} is {@code true} only when no pattern was found and no un-normalized
 * operation remains. A result is computed fresh for every call and never cached.
 * </p>
 *
 * @param isFullySimplified         No patterns and no unsimplified operations.
 * @param patterns                  Every pattern found, in detection order.
 * @param hasUnsimplifiedOperations A constant-only operation or a coefficient of 1 or -1 exists anywhere in the tree.
 */
public record TreeAnalysisResult(boolean isFullySimplified, List<SimplificationPattern> patterns, boolean hasUnsimplifiedOperations) {

    private static final TreeAnalysisResult EMPTY = new TreeAnalysisResult(false, List.of(), false);

    public TreeAnalysisResult {
        patterns = List.copyOf(patterns);
    }

    /**
     * Builds a result whose {@code isFullySimplified} flag is derived from the other two fields.
     */
    public static TreeAnalysisResult of(List<SimplificationPattern> patterns, boolean hasUnsimplifiedOperations) {
        return new TreeAnalysisResult(patterns.isEmpty() && !hasUnsimplifiedOperations, patterns, hasUnsimplifiedOperations);
    }

    /**
     * The conservative result for input that could not be analysed.
     */
    public static TreeAnalysisResult empty() {
        return EMPTY;
    }

    public List<PatternKind> patternKinds() {
        return patterns.stream().map(SimplificationPattern::kind).toList();
    }
}
