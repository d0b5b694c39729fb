package com.stepwise.service.api;

/**
 * Decides whether two inputs denote the same value for every assignment of their variables.
 */
public interface EquivalenceChecker {

    /**
     * Compares two expressions, or two equations, for equivalence.
     * <p>
     * Tries a structural comparison first, then a symbolic difference, and finally evaluates the
     * difference at a fixed set of sample points. The numeric fallback gives bounded confidence, not
     * a proof. This method never throws: input that cannot be read is simply not equivalent.
     * </p>
     *
     * @param a The first input.
     * @param b The second input.
     * @return {@code true} if the inputs are judged equivalent.
     */
    boolean areEquivalent(String a, String b);
}
