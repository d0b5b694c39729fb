package com.stepwise.algebra;

/**
 * Renders trees as infix text.
 * <p>
 * Parentheses are added only where precedence or right-nesting requires them, and a numeric
 * coefficient followed by a variable, power, function or bracketed sum is written with implicit
 * multiplication ({@code 2x}, {@code 3x^2}, {@code 2(x + 1)}). Output always parses back into a
 * tree that simplifies to the same result.
 * </p>
 */
final class NodeFormatter {

    private static final int ADDITIVE = 1;
    private static final int MULTIPLICATIVE = 2;
    private static final int UNARY = 3;
    private static final int POWER = 4;
    private static final int ATOM = 5;

    private NodeFormatter() {
    }

    static String format(Node node) {
        return switch (node.kind()) {
            case CONSTANT -> ((Constant) node).value().toPlainString();
            case SYMBOL -> ((Symbol) node).name();
            case PARENTHESIS -> "(" + format(((Parenthesis) node).content()) + ")";
            case OPERATOR -> formatOperator((Operator) node);
        };
    }

    private static String formatOperator(Operator op) {
        if (op.isFunction()) {
            return op.op() + "(" + format(op.left()) + ")";
        }
        if (op.isUnaryMinus()) {
            Node operand = op.left();
            boolean wrap = precedence(operand) < MULTIPLICATIVE || precedence(operand) == UNARY;
            return "-" + wrapIf(operand, wrap);
        }
        Node left = op.left();
        Node right = op.right();
        return switch (op.op()) {
            case Operator.ADD, Operator.SUBTRACT ->
                    format(left) + " " + op.op() + " " + wrapIf(right, precedence(right) <= ADDITIVE);
            case Operator.MULTIPLY -> formatProduct(left, right);
            case Operator.DIVIDE -> wrapIf(left, precedence(left) < MULTIPLICATIVE)
                    + " / " + wrapIf(right, precedence(right) <= MULTIPLICATIVE);
            case Operator.POWER -> wrapIf(left, precedence(left) < ATOM)
                    + "^" + wrapIf(right, precedence(right) < ATOM);
            default -> op.op() + op.args();
        };
    }

    private static String formatProduct(Node left, Node right) {
        String leftText = wrapIf(left, precedence(left) < MULTIPLICATIVE);
        if (left.isConstant() && impliesMultiplication(right)) {
            return leftText + wrapIf(right, precedence(right) <= MULTIPLICATIVE);
        }
        return leftText + " * " + wrapIf(right, precedence(right) <= MULTIPLICATIVE);
    }

    private static boolean impliesMultiplication(Node right) {
        return switch (right.kind()) {
            case SYMBOL, PARENTHESIS -> true;
            case CONSTANT -> false;
            case OPERATOR -> {
                Operator op = (Operator) right;
                yield op.isFunction()
                        || op.isAdditive()
                        || (op.isPower() && op.left().kind() == NodeKind.SYMBOL);
            }
        };
    }

    private static String wrapIf(Node node, boolean wrap) {
        return wrap ? "(" + format(node) + ")" : format(node);
    }

    private static int precedence(Node node) {
        return switch (node.kind()) {
            case SYMBOL, PARENTHESIS -> ATOM;
            case CONSTANT -> ((Constant) node).isNegative() ? UNARY : ATOM;
            case OPERATOR -> {
                Operator op = (Operator) node;
                if (op.isFunction()) {
                    yield ATOM;
                }
                if (op.isUnaryMinus()) {
                    yield UNARY;
                }
                yield switch (op.op()) {
                    case Operator.ADD, Operator.SUBTRACT -> ADDITIVE;
                    case Operator.MULTIPLY, Operator.DIVIDE -> MULTIPLICATIVE;
                    case Operator.POWER -> POWER;
                    default -> ATOM;
                };
            }
        };
    }
}
