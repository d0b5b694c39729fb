package com.stepwise.service.api;

import com.stepwise.exception.MathParsingException;
import com.stepwise.model.CanonicalForm;

/**
 * Reduces an expression or equation to one deterministic tree.
 * <p>
 * Inputs that are equal in value but differ in term order, in implicit versus explicit
 * coefficients, or (for equations) in which side is written first, produce structurally equal trees.
 * An equation {@code L = R} is canonicalized as the expression {@code L - R} with a positive leading
 * variable coefficient.
 * </p>
 */
public interface Canonicalizer {

    /**
     * Computes the canonical form of {@code input}.
     * <p>
     * Normalization steps that fail keep the tree they were given; the result then reports
     * {@link CanonicalForm#degraded()}.
     * </p>
     *
     * @param input An expression or an equation.
     * @return The canonical form.
     * @throws MathParsingException if the input fails the syntax pre-check or cannot be parsed.
     */
    CanonicalForm canonicalize(String input);
}
