package com.stepwise.algebra;

import com.stepwise.algebra.Polynomial.Factor;
import com.stepwise.algebra.Polynomial.Term;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites trees into a deterministic sum-of-terms form with exact rational arithmetic.
 * <p>
 * {@link #simplify(Node)} folds constants, combines like terms, distributes numeric factors over
 * sums and cancels single-term divisions, but leaves a product of a variable factor with a sum
 * (such as {@code x(x + 1)}) as it is. {@link #expand(Node)} additionally multiplies those products
 * out, along with small non-negative integer powers of sums.
 * </p>
 * <p>
 * Terms come out ordered with variable terms first (by leading variable name, then descending
 * power) and the constant term last.
 * </p>
 */
public final class Simplifier {

    private static final int MAX_INTEGER_POWER = 64;
    private static final int MAX_EXPANDED_POWER = 8;

    private static final Comparator<Term> TERM_ORDER = Comparator
            .comparing(Term::isConstant)
            .thenComparing(Simplifier::leadingVariable)
            .thenComparing(Comparator.<Term>comparingInt(Simplifier::leadingExponent).reversed())
            .thenComparing(Term::signature);

    public Node simplify(Node node) {
        return toNode(convert(node, false));
    }

    public Node expand(Node node) {
        return toNode(convert(node, true));
    }

    private Polynomial convert(Node node, boolean expand) {
        return switch (node.kind()) {
            case CONSTANT -> Polynomial.constant(Rational.of(((Constant) node).value()));
            case SYMBOL -> Polynomial.of(Term.of(node, 1));
            case PARENTHESIS -> convert(((Parenthesis) node).content(), expand);
            case OPERATOR -> convertOperator((Operator) node, expand);
        };
    }

    private Polynomial convertOperator(Operator op, boolean expand) {
        if (op.isFunction()) {
            return applyFunction(op.op(), convert(op.left(), expand));
        }
        if (op.isUnaryMinus()) {
            return convert(op.left(), expand).negate();
        }
        if (op.args().size() != 2) {
            throw new IllegalArgumentException("Unsupported operator '" + op.op() + "' with " + op.args().size() + " arguments");
        }
        Polynomial left = convert(op.left(), expand);
        Polynomial right = convert(op.right(), expand);
        return switch (op.op()) {
            case Operator.ADD -> left.add(right);
            case Operator.SUBTRACT -> left.add(right.negate());
            case Operator.MULTIPLY -> multiply(left, right, expand);
            case Operator.DIVIDE -> divide(left, right, expand);
            case Operator.POWER -> power(left, right, expand);
            default -> throw new IllegalArgumentException("Unsupported operator '" + op.op() + "'");
        };
    }

    private Polynomial multiply(Polynomial a, Polynomial b, boolean expand) {
        if (a.isZero() || b.isZero()) {
            return Polynomial.zero();
        }
        if (a.isConstant()) {
            return b.scale(a.constantValue());
        }
        if (b.isConstant()) {
            return a.scale(b.constantValue());
        }
        if (expand || (a.isSingleTerm() && b.isSingleTerm())) {
            return settle(a.multiply(b), expand);
        }
        return settle(Polynomial.of(asTerm(a).multiply(asTerm(b))), expand);
    }

    private Polynomial divide(Polynomial numerator, Polynomial denominator, boolean expand) {
        if (denominator.isZero()) {
            return opaque(new Operator(Operator.DIVIDE, List.of(toNode(numerator), Constant.ZERO)));
        }
        if (denominator.isConstant()) {
            return numerator.scale(denominator.constantValue().reciprocal());
        }
        if (numerator.isZero()) {
            return Polynomial.zero();
        }
        if (denominator.isSingleTerm()) {
            return multiply(numerator, Polynomial.of(denominator.singleTerm().pow(-1)), expand);
        }
        // a sum in the denominator stays a factor; the numerator is kept whole so that equal sums cancel
        Term reciprocal = Term.of(toNode(denominator), -1);
        return multiply(numerator, Polynomial.of(reciprocal), false);
    }

    private Polynomial power(Polynomial base, Polynomial exponent, boolean expand) {
        Integer n = exponent.smallIntegerValue(MAX_INTEGER_POWER);
        if (n == null) {
            return opaque(Operator.binary(Operator.POWER, toNode(base), toNode(exponent)));
        }
        if (n == 0) {
            return Polynomial.constant(Rational.ONE);
        }
        if (base.isZero()) {
            return n > 0 ? Polynomial.zero() : opaque(Operator.binary(Operator.POWER, Constant.ZERO, Constant.of(n)));
        }
        if (base.isSingleTerm()) {
            return settle(Polynomial.of(base.singleTerm().pow(n)), expand);
        }
        if (expand && n > 0 && n <= MAX_EXPANDED_POWER) {
            Polynomial result = base;
            for (int i = 1; i < n; i++) {
                result = result.multiply(base);
            }
            return result;
        }
        return Polynomial.of(Term.of(toNode(base), n));
    }

    private Polynomial applyFunction(String name, Polynomial argument) {
        if (argument.isConstant()) {
            Rational value = argument.constantValue();
            if ("abs".equals(name)) {
                return Polynomial.constant(value.abs());
            }
            if ("sqrt".equals(name)) {
                Rational root = value.sqrtExact();
                if (root != null) {
                    return Polynomial.constant(root);
                }
            }
        }
        return opaque(new Operator(name, List.of(toNode(argument))));
    }

    private static Polynomial opaque(Node node) {
        return Polynomial.of(Term.of(node, 1));
    }

    private Term asTerm(Polynomial p) {
        return p.isSingleTerm() ? p.singleTerm() : Term.of(toNode(p), 1);
    }

    /**
     * Dissolves terms that ended up as a lone sum factor, e.g. {@code (x + 1)(x + 2) / (x + 2)},
     * back into the surrounding sum.
     */
    private Polynomial settle(Polynomial p, boolean expand) {
        Polynomial result = Polynomial.zero();
        for (Term term : p.terms()) {
            if (term.factors().size() == 1) {
                Factor only = term.factors().values().iterator().next();
                if (only.exponent() == 1 && only.base() instanceof Operator op && op.isAdditive()) {
                    result = result.add(convert(op, expand).scale(term.coefficient()));
                    continue;
                }
            }
            result = result.add(Polynomial.of(term));
        }
        return result;
    }

    private Node toNode(Polynomial p) {
        List<Term> ordered = p.terms().stream().sorted(TERM_ORDER).toList();
        Node result = null;
        for (Term term : ordered) {
            Node magnitude = termNode(term.coefficient().abs(), term);
            boolean negative = term.coefficient().signum() < 0;
            if (result == null) {
                result = negative ? negateLeading(magnitude) : magnitude;
            } else {
                result = Operator.binary(negative ? Operator.SUBTRACT : Operator.ADD, result, magnitude);
            }
        }
        return result == null ? Constant.ZERO : result;
    }

    private static Node termNode(Rational magnitude, Term term) {
        List<Node> numerator = new ArrayList<>();
        List<Node> denominator = new ArrayList<>();
        boolean hasNumeratorFactor = term.factors().values().stream().anyMatch(f -> f.exponent() > 0);
        if (!magnitude.numerator().equals(BigInteger.ONE) || !hasNumeratorFactor) {
            numerator.add(Constant.of(magnitude.numerator()));
        }
        if (!magnitude.denominator().equals(BigInteger.ONE)) {
            denominator.add(Constant.of(magnitude.denominator()));
        }
        for (Factor factor : term.factors().values()) {
            if (factor.exponent() > 0) {
                numerator.add(raised(factor.base(), factor.exponent()));
            } else {
                denominator.add(raised(factor.base(), -factor.exponent()));
            }
        }
        Node top = product(numerator);
        return denominator.isEmpty() ? top : Operator.binary(Operator.DIVIDE, top, product(denominator));
    }

    private static Node raised(Node base, int exponent) {
        return exponent == 1 ? base : Operator.binary(Operator.POWER, base, Constant.of(exponent));
    }

    private static Node product(List<Node> factors) {
        Node result = factors.get(0);
        for (int i = 1; i < factors.size(); i++) {
            result = Operator.binary(Operator.MULTIPLY, result, factors.get(i));
        }
        return result;
    }

    private static Node negateLeading(Node node) {
        if (node instanceof Constant constant) {
            return new Constant(constant.value().negate());
        }
        if (node instanceof Operator op && (op.isMultiplication() || op.isDivision()) && leadsWithConstant(op.left())) {
            return Operator.binary(op.op(), negateLeading(op.left()), op.right());
        }
        return Operator.negate(node);
    }

    private static boolean leadsWithConstant(Node node) {
        if (node instanceof Constant) {
            return true;
        }
        return node instanceof Operator op && (op.isMultiplication() || op.isDivision()) && leadsWithConstant(op.left());
    }

    private static String leadingVariable(Term term) {
        return term.factors().isEmpty() ? "" : term.factors().firstKey();
    }

    private static int leadingExponent(Term term) {
        return term.factors().isEmpty() ? 0 : term.factors().get(term.factors().firstKey()).exponent();
    }
}
