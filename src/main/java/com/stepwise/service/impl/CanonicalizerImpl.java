package com.stepwise.service.impl;

import com.stepwise.algebra.AlgebraParseException;
import com.stepwise.algebra.Constant;
import com.stepwise.algebra.Node;
import com.stepwise.algebra.Nodes;
import com.stepwise.algebra.Operator;
import com.stepwise.algebra.Parenthesis;
import com.stepwise.algebra.SignedTerm;
import com.stepwise.algebra.Symbol;
import com.stepwise.exception.MathParsingException;
import com.stepwise.exception.ParsingErrorKind;
import com.stepwise.model.CanonicalForm;
import com.stepwise.model.ParsedInput;
import com.stepwise.service.api.AlgebraBackend;
import com.stepwise.service.api.Canonicalizer;
import com.stepwise.service.api.InputSyntaxValidator;
import com.stepwise.util.Attempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Default {@link Canonicalizer}.
 * <p>
 * After parsing, the tree goes through a fixed chain of normalizations: simplify, expand to a fixed
 * point, normalize coefficients, normalize the sign (equations only), order the top-level terms and
 * simplify once more. Each step either succeeds or leaves the tree it was given, in which case the
 * result is marked degraded and a warning is logged.
 * </p>
 */
@Service
public class CanonicalizerImpl implements Canonicalizer {

    private static final Logger log = LoggerFactory.getLogger(CanonicalizerImpl.class);

    static final int MAX_EXPANSION_ITERATIONS = 3;

    private static final String NUMBER = "\\d+(\\.\\d+)?";
    private static final Pattern NEGATIVE_VARIABLE_LEAD =
            Pattern.compile("^-\\s*(" + NUMBER + ")?\\s*\\*?\\s*[a-zA-Z(]");
    private static final Pattern CONSTANT_MINUS_VARIABLE =
            Pattern.compile("^" + NUMBER + "\\s*-\\s*(" + NUMBER + ")?\\s*\\*?\\s*[a-zA-Z(]");

    private static final Comparator<ClassifiedTerm> TERM_ORDER = Comparator
            .comparing(ClassifiedTerm::constant)
            .thenComparing(ClassifiedTerm::variable)
            .thenComparing(Comparator.comparingDouble(ClassifiedTerm::power).reversed())
            .thenComparingDouble(ClassifiedTerm::value);

    /**
     * A top-level summand with the keys it is sorted by.
     */
    private record ClassifiedTerm(Node term, boolean negative, boolean constant, String variable, double power, double value) {}

    private final InputSyntaxValidator inputSyntaxValidator;
    private final AlgebraBackend algebraBackend;

    public CanonicalizerImpl(InputSyntaxValidator inputSyntaxValidator, AlgebraBackend algebraBackend) {
        this.inputSyntaxValidator = inputSyntaxValidator;
        this.algebraBackend = algebraBackend;
    }

    @Override
    public CanonicalForm canonicalize(String input) {
        ParsedInput parsed = inputSyntaxValidator.validate(input);
        String expression = parsed.isEquation()
                ? "(" + parsed.leftSide() + ") - (" + parsed.rightSide() + ")"
                : parsed.trimmed();

        var normalization = new Normalization(input, parse(expression, input))
                .then("simplify", algebraBackend::simplify)
                .then("expand", this::expandToFixedPoint)
                .then("coefficient normalization", CanonicalizerImpl::normalizeCoefficients);
        if (parsed.isEquation()) {
            normalization.then("sign normalization", this::normalizeSign);
        }
        normalization
                .then("term ordering", this::orderTerms)
                .then("final simplify", tree -> algebraBackend.simplify(algebraBackend.parse(tree.toString())));

        log.debug("Canonical form of '{}' is '{}'{}", parsed.trimmed(), normalization.tree,
                normalization.degraded ? " (degraded)" : "");
        return new CanonicalForm(normalization.tree, normalization.degraded);
    }

    private Node parse(String expression, String input) {
        try {
            return algebraBackend.parse(expression);
        } catch (AlgebraParseException e) {
            throw new MathParsingException(ParsingErrorKind.BACKEND_PARSE_FAILURE,
                    "Failed to parse mathematical expression: " + e.getMessage(), input, e);
        }
    }

    /**
     * Re-parses and expands until the text stops changing, at most {@link #MAX_EXPANSION_ITERATIONS} times.
     */
    Node expandToFixedPoint(Node tree) {
        Node current = tree;
        String previous = current.toString();
        for (int i = 0; i < MAX_EXPANSION_ITERATIONS; i++) {
            current = algebraBackend.simplify(algebraBackend.expand(algebraBackend.parse(previous)));
            String text = current.toString();
            if (text.equals(previous)) {
                break;
            }
            previous = text;
        }
        return current;
    }

    /**
     * Post-order rewrite of multiplications by a constant: {@code 0 * a} becomes {@code 0},
     * {@code 1 * a} becomes {@code a}, {@code -1 * a} becomes {@code -a}, and a trailing constant
     * moves to the front.
     */
    static Node normalizeCoefficients(Node node) {
        return switch (node.kind()) {
            case CONSTANT, SYMBOL -> node;
            case PARENTHESIS -> new Parenthesis(normalizeCoefficients(((Parenthesis) node).content()));
            case OPERATOR -> {
                Operator op = (Operator) node;
                var args = op.args().stream().map(CanonicalizerImpl::normalizeCoefficients).toList();
                var rebuilt = new Operator(op.op(), args);
                yield rebuilt.isMultiplication() ? normalizeProduct(rebuilt) : rebuilt;
            }
        };
    }

    private static Node normalizeProduct(Operator product) {
        Node left = product.left();
        Node right = product.right();
        if (left instanceof Constant coefficient) {
            return applyCoefficient(coefficient, right, product);
        }
        if (right instanceof Constant coefficient) {
            Node normalized = applyCoefficient(coefficient, left, product);
            return normalized == product ? Operator.binary(Operator.MULTIPLY, right, left) : normalized;
        }
        return product;
    }

    private static Node applyCoefficient(Constant coefficient, Node other, Operator product) {
        if (coefficient.hasValue(0)) {
            return Constant.ZERO;
        }
        if (coefficient.hasValue(1)) {
            return other;
        }
        if (coefficient.hasValue(-1)) {
            return Operator.negate(other);
        }
        return product;
    }

    /**
     * Negates the expression when its leading term is a negative variable term, so that
     * {@code A = B} and {@code B = A} end up identical.
     */
    private Node normalizeSign(Node tree) {
        String text = tree.toString();
        if (NEGATIVE_VARIABLE_LEAD.matcher(text).find() || CONSTANT_MINUS_VARIABLE.matcher(text).find()) {
            log.debug("Flipping sign of '{}'", text);
            return algebraBackend.simplify(Operator.negate(tree));
        }
        return tree;
    }

    private Node orderTerms(Node tree) {
        List<ClassifiedTerm> ordered = SignedTerm.decompose(tree).stream()
                .map(this::classify)
                .sorted(TERM_ORDER)
                .toList();

        Node result = null;
        for (ClassifiedTerm term : ordered) {
            if (result == null) {
                result = term.negative() ? Operator.negate(term.term()) : term.term();
            } else {
                result = Operator.binary(term.negative() ? Operator.SUBTRACT : Operator.ADD, result, term.term());
            }
        }
        return result;
    }

    private ClassifiedTerm classify(SignedTerm signed) {
        Node term = signed.term();
        if (Nodes.isConstantExpression(term)) {
            double value = algebraBackend.evaluate(term, Map.of());
            return new ClassifiedTerm(term, signed.negative(), true, "", 0, signed.negative() ? -value : value);
        }

        Node factor = leadingVariableFactor(term);
        if (factor instanceof Symbol symbol) {
            return new ClassifiedTerm(term, signed.negative(), false, symbol.name(), 1, 0);
        }
        if (factor instanceof Operator power && power.isPower()
                && power.left() instanceof Symbol base && power.right() instanceof Constant exponent) {
            return new ClassifiedTerm(term, signed.negative(), false, base.name(), exponent.value().doubleValue(), 0);
        }
        return new ClassifiedTerm(term, signed.negative(), false, factor.toString(), 1, 0);
    }

    /**
     * Descends through products and quotients to the first factor that contains a variable.
     */
    private static Node leadingVariableFactor(Node term) {
        Node current = Nodes.unwrap(term);
        while (current instanceof Operator op && (op.isMultiplication() || op.isDivision())) {
            current = Nodes.unwrap(Nodes.isConstantExpression(op.left()) ? op.right() : op.left());
        }
        return current;
    }

    /**
     * The tree being normalized, and whether any step had to fall back.
     */
    private static final class Normalization {

        private final String input;
        private Node tree;
        private boolean degraded;

        Normalization(String input, Node tree) {
            this.input = input;
            this.tree = tree;
        }

        Normalization then(String step, UnaryOperator<Node> transform) {
            Node before = tree;
            tree = Attempt.of(() -> transform.apply(before)).recover(e -> {
                log.warn("Canonicalization step '{}' failed for '{}', keeping the previous form: {}",
                        step, input, e.getMessage());
                degraded = true;
                return before;
            });
            return this;
        }
    }
}
