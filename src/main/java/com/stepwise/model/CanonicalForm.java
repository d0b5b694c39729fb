package com.stepwise.model;

import com.stepwise.algebra.Node;

/**
 * The canonical tree of an expression or equation.
 *
 * @param tree     The canonical tree. For an equation this is {@code left - right}, sign-normalized.
 * @param degraded {@code true} if a normalization step failed and an earlier tree was kept. Term
 *                 order in a degraded form is not guaranteed.
 */
public record CanonicalForm(Node tree, boolean degraded) {

    @Override
    public String toString() {
        return tree.toString();
    }
}
