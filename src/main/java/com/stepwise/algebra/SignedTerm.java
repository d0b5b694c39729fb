package com.stepwise.algebra;

import java.util.ArrayList;
import java.util.List;

/**
 * One summand of an expression together with the sign it carries in the sum.
 *
 * @param term     The summand, never itself a top-level sum or unary negation.
 * @param negative {@code true} if the summand is subtracted.
 */
public record SignedTerm(Node term, boolean negative) {

    /**
     * Splits the top-level chain of {@code +} and {@code -} into summands.
     * <p>
     * A leading unary minus flips the sign of its operand; binary subtraction flips the sign of its
     * right operand only. Parenthesised sums are not entered.
     * </p>
     */
    public static List<SignedTerm> decompose(Node root) {
        List<SignedTerm> terms = new ArrayList<>();
        decompose(root, false, terms);
        return terms;
    }

    private static void decompose(Node node, boolean negative, List<SignedTerm> out) {
        if (node instanceof Operator op) {
            if (op.isUnaryMinus()) {
                decompose(op.left(), !negative, out);
                return;
            }
            if (op.isAdditive()) {
                decompose(op.left(), negative, out);
                decompose(op.right(), Operator.SUBTRACT.equals(op.op()) != negative, out);
                return;
            }
        }
        out.add(new SignedTerm(node, negative));
    }
}
