package com.stepwise.algebra;

import java.util.Map;

/**
 * Numeric evaluation of a tree under a variable binding.
 */
public final class Evaluator {

    private Evaluator() {
    }

    /**
     * @param node     The tree to evaluate.
     * @param bindings A value for every variable in the tree.
     * @return The value as a finite double.
     * @throws ArithmeticException      on division by zero or a non-finite intermediate result.
     * @throws IllegalArgumentException if a variable has no binding.
     */
    public static double evaluate(Node node, Map<String, Double> bindings) {
        double value = switch (node.kind()) {
            case CONSTANT -> ((Constant) node).value().doubleValue();
            case SYMBOL -> {
                String name = ((Symbol) node).name();
                Double bound = bindings.get(name);
                if (bound == null) {
                    throw new IllegalArgumentException("No value bound for variable '" + name + "'");
                }
                yield bound;
            }
            case PARENTHESIS -> evaluate(((Parenthesis) node).content(), bindings);
            case OPERATOR -> evaluateOperator((Operator) node, bindings);
        };
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("Undefined value for " + node);
        }
        return value;
    }

    private static double evaluateOperator(Operator op, Map<String, Double> bindings) {
        double left = evaluate(op.left(), bindings);
        if (op.isUnaryMinus()) {
            return -left;
        }
        if (op.isFunction()) {
            return switch (op.op()) {
                case "sqrt" -> Math.sqrt(left);
                case "abs" -> Math.abs(left);
                default -> throw new IllegalArgumentException("Unknown function '" + op.op() + "'");
            };
        }
        double right = evaluate(op.right(), bindings);
        return switch (op.op()) {
            case Operator.ADD -> left + right;
            case Operator.SUBTRACT -> left - right;
            case Operator.MULTIPLY -> left * right;
            case Operator.DIVIDE -> {
                if (right == 0.0) {
                    throw new ArithmeticException("Division by zero in " + op);
                }
                yield left / right;
            }
            case Operator.POWER -> Math.pow(left, right);
            default -> throw new IllegalArgumentException("Unknown operator '" + op.op() + "'");
        };
    }
}
