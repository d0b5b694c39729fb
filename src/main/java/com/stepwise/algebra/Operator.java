package com.stepwise.algebra;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An operator or function application.
 * <p>
 * Binary operators are {@code + - * / ^}. A {@code -} with a single argument is unary negation.
 * Function applications ({@code sqrt}, {@code abs}) use the function name as {@code op} and
 * carry exactly one argument.
 * </p>
 */
public record Operator(String op, List<Node> args) implements Node {

    public static final String ADD = "+";
    public static final String SUBTRACT = "-";
    public static final String MULTIPLY = "*";
    public static final String DIVIDE = "/";
    public static final String POWER = "^";

    public static final Set<String> FUNCTIONS = Set.of("sqrt", "abs");

    public Operator {
        Objects.requireNonNull(op, "op");
        args = List.copyOf(args);
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Operator '" + op + "' needs at least one argument");
        }
    }

    public static Operator binary(String op, Node left, Node right) {
        return new Operator(op, List.of(left, right));
    }

    public static Operator negate(Node operand) {
        return new Operator(SUBTRACT, List.of(operand));
    }

    public Node left() {
        return args.get(0);
    }

    public Node right() {
        return args.get(args.size() - 1);
    }

    public boolean isUnaryMinus() {
        return SUBTRACT.equals(op) && args.size() == 1;
    }

    /**
     * @return {@code true} for a binary {@code +} or {@code -}.
     */
    public boolean isAdditive() {
        return args.size() == 2 && (ADD.equals(op) || SUBTRACT.equals(op));
    }

    public boolean isMultiplication() {
        return MULTIPLY.equals(op) && args.size() == 2;
    }

    public boolean isDivision() {
        return DIVIDE.equals(op) && args.size() == 2;
    }

    public boolean isPower() {
        return POWER.equals(op) && args.size() == 2;
    }

    public boolean isFunction() {
        return FUNCTIONS.contains(op);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPERATOR;
    }

    @Override
    public List<Node> children() {
        return args;
    }

    @Override
    public String toString() {
        return NodeFormatter.format(this);
    }
}
