package com.stepwise.service.api;

import com.stepwise.algebra.AlgebraParseException;
import com.stepwise.algebra.Node;

import java.util.Map;

/**
 * The symbolic algebra engine the validation core is built on.
 * <p>
 * Trees returned by the backend are immutable and compare structurally through {@link Node#equals(Object)};
 * deciding whether two different trees have the same value is left to the {@link EquivalenceChecker}.
 * All operations are pure and safe to call concurrently.
 * </p>
 */
public interface AlgebraBackend {

    /**
     * Parses infix text (no {@code =} sign) into a tree.
     *
     * @param text The expression text.
     * @return The parsed tree.
     * @throws AlgebraParseException on a lexical or grammatical error.
     */
    Node parse(String text);

    /**
     * Folds constant arithmetic, combines like terms and distributes numeric factors.
     * Products of a variable factor with a sum are left unexpanded.
     *
     * @param tree The tree to simplify.
     * @return A deterministic, simplified tree.
     */
    Node simplify(Node tree);

    /**
     * Like {@link #simplify(Node)}, but also multiplies out every product with a sum and small
     * non-negative integer powers of sums.
     *
     * @param tree The tree to expand.
     * @return The expanded, simplified tree.
     */
    Node expand(Node tree);

    /**
     * Evaluates a tree numerically.
     *
     * @param tree     The tree.
     * @param bindings A value for every variable in the tree.
     * @return The finite value.
     * @throws ArithmeticException      on division by zero or a non-finite result.
     * @throws IllegalArgumentException if a variable is unbound.
     */
    double evaluate(Node tree, Map<String, Double> bindings);
}
