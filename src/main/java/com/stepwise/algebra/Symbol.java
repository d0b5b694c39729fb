package com.stepwise.algebra;

import java.util.List;
import java.util.Objects;

/**
 * A free variable such as {@code x}.
 */
public record Symbol(String name) implements Node {

    public Symbol {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SYMBOL;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return name;
    }
}
