package com.stepwise.algebra;

import java.util.List;

/**
 * An immutable node of a parsed algebraic expression.
 * <p>
 * Equality is structural: two trees are equal when they have the same shape and
 * the same leaves. Semantic equality is decided elsewhere.
 * {@link #toString()} renders infix text that the {@link ExpressionParser} accepts.
 * </p>
 */
public sealed interface Node permits Constant, Symbol, Operator, Parenthesis {

    NodeKind kind();

    /**
     * @return The direct children of this node, left to right. Leaves return an empty list.
     */
    List<Node> children();

    default boolean isConstant() {
        return kind() == NodeKind.CONSTANT;
    }
}
