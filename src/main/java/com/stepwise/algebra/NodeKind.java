package com.stepwise.algebra;

/**
 * The closed set of node kinds an expression tree is built from.
 * <p>
 * Every tree walk in the project switches over this enumeration instead of
 * inspecting runtime classes, so adding a kind is a compile-visible change.
 * </p>
 */
public enum NodeKind {
    CONSTANT,
    SYMBOL,
    OPERATOR,
    PARENTHESIS
}
