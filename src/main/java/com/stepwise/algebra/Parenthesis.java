package com.stepwise.algebra;

import java.util.List;
import java.util.Objects;

/**
 * Explicit parentheses written by the author of an expression.
 * <p>
 * The parser keeps them so that detectors can tell {@code 2(x + 3)} apart from an already
 * distributed form. {@code simplify} never emits them.
 * </p>
 */
public record Parenthesis(Node content) implements Node {

    public Parenthesis {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARENTHESIS;
    }

    @Override
    public List<Node> children() {
        return List.of(content);
    }

    @Override
    public String toString() {
        return NodeFormatter.format(this);
    }
}
