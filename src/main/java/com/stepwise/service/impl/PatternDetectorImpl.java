package com.stepwise.service.impl;

import com.stepwise.algebra.Constant;
import com.stepwise.algebra.Node;
import com.stepwise.algebra.Nodes;
import com.stepwise.algebra.Operator;
import com.stepwise.algebra.SignedTerm;
import com.stepwise.algebra.Symbol;
import com.stepwise.model.ParsedInput;
import com.stepwise.model.PatternKind;
import com.stepwise.model.SimplificationPattern;
import com.stepwise.model.TreeAnalysisResult;
import com.stepwise.service.api.AlgebraBackend;
import com.stepwise.service.api.InputSyntaxValidator;
import com.stepwise.service.api.PatternDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default {@link PatternDetector}.
 * <p>
 * Constant-only operations are reported only when simplifying them changes their text, so an
 * irreducible fraction such as {@code 2/3} or a value like {@code sqrt(2)} counts as simplified.
 * </p>
 */
@Service
public class PatternDetectorImpl implements PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetectorImpl.class);

    private static final String CONSTANT_SIGNATURE = "#constant";
    private static final Pattern COSMETIC = Pattern.compile("[\\s*]");

    private final InputSyntaxValidator inputSyntaxValidator;
    private final AlgebraBackend algebraBackend;

    public PatternDetectorImpl(InputSyntaxValidator inputSyntaxValidator, AlgebraBackend algebraBackend) {
        this.inputSyntaxValidator = inputSyntaxValidator;
        this.algebraBackend = algebraBackend;
    }

    @Override
    public TreeAnalysisResult analyze(String input) {
        try {
            ParsedInput parsed = inputSyntaxValidator.validate(input);
            List<Node> sides = parsed.isEquation()
                    ? List.of(algebraBackend.parse(parsed.leftSide()), algebraBackend.parse(parsed.rightSide()))
                    : List.of(algebraBackend.parse(parsed.trimmed()));

            List<SimplificationPattern> patterns = new ArrayList<>();
            boolean unsimplified = false;
            for (Node side : sides) {
                patterns.addAll(constantArithmetic(side));
                patterns.addAll(likeTerms(side));
                patterns.addAll(distributive(side));
                patterns.addAll(coefficientNormalization(side));
                unsimplified |= hasUnsimplifiedOperations(side);
            }
            log.debug("Analysed '{}': {} pattern(s), unsimplified operations: {}", parsed.trimmed(), patterns.size(), unsimplified);
            return TreeAnalysisResult.of(patterns, unsimplified);
        } catch (RuntimeException e) {
            log.debug("Could not analyse '{}': {}", input, e.getMessage());
            return TreeAnalysisResult.empty();
        }
    }

    @Override
    public boolean isFullySimplified(String input) {
        try {
            ParsedInput parsed = inputSyntaxValidator.validate(input);
            if (parsed.isEquation()) {
                return sideIsSimplified(parsed.leftSide()) && sideIsSimplified(parsed.rightSide());
            }
            return sideIsSimplified(parsed.trimmed());
        } catch (RuntimeException e) {
            log.debug("Could not check simplification of '{}': {}", input, e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> feedbackFor(List<SimplificationPattern> patterns) {
        return patterns.stream().map(SimplificationPattern::feedback).toList();
    }

    // --- SUB-DETECTORS ---

    /**
     * Operators whose arguments are all constants, plus a top-level sum with more than one constant term.
     */
    List<SimplificationPattern> constantArithmetic(Node tree) {
        List<SimplificationPattern> patterns = new ArrayList<>();
        for (Node node : Nodes.preOrder(tree)) {
            if (node instanceof Operator op && isReducibleConstantOperation(op)) {
                Node simplified = algebraBackend.simplify(op);
                patterns.add(new SimplificationPattern(PatternKind.CONSTANT_ARITHMETIC,
                        "Constant arithmetic operation: " + op,
                        List.of(op),
                        op + " becomes " + simplified));
            }
        }

        // a constant-only sum is already reported above
        boolean sumReported = patterns.stream()
                .anyMatch(p -> p.affectedNodes().get(0) instanceof Operator op && op.isAdditive());
        List<SignedTerm> constants = SignedTerm.decompose(tree).stream()
                .filter(term -> Nodes.isConstantExpression(term.term()))
                .toList();
        if (constants.size() > 1 && !sumReported) {
            Node sum = rebuild(constants);
            patterns.add(new SimplificationPattern(PatternKind.CONSTANT_ARITHMETIC,
                    "Separate constant terms: " + sum,
                    constants.stream().map(SignedTerm::term).toList(),
                    sum + " becomes " + algebraBackend.simplify(sum)));
        }
        return patterns;
    }

    /**
     * Top-level terms that share a variable signature.
     */
    List<SimplificationPattern> likeTerms(Node tree) {
        Map<String, List<Node>> groups = new LinkedHashMap<>();
        for (SignedTerm term : SignedTerm.decompose(tree)) {
            groups.computeIfAbsent(signature(term.term()), key -> new ArrayList<>()).add(term.term());
        }

        List<SimplificationPattern> patterns = new ArrayList<>();
        groups.forEach((signature, terms) -> {
            if (terms.size() > 1 && !CONSTANT_SIGNATURE.equals(signature)) {
                String joined = terms.stream().map(Node::toString).collect(Collectors.joining(" + "));
                patterns.add(new SimplificationPattern(PatternKind.LIKE_TERMS,
                        "Like terms with variable part: " + signature,
                        terms,
                        joined));
            }
        });
        return patterns;
    }

    /**
     * Products with a sum or difference as one operand.
     */
    List<SimplificationPattern> distributive(Node tree) {
        List<SimplificationPattern> patterns = new ArrayList<>();
        for (Node node : Nodes.preOrder(tree)) {
            if (node instanceof Operator op && op.isMultiplication() && (isSum(op.left()) || isSum(op.right()))) {
                patterns.add(new SimplificationPattern(PatternKind.DISTRIBUTIVE,
                        "Distributive property opportunity: " + op,
                        List.of(op),
                        "multiply out " + op));
            }
        }
        return patterns;
    }

    /**
     * Multiplications by a literal 0, 1 or -1.
     */
    List<SimplificationPattern> coefficientNormalization(Node tree) {
        List<SimplificationPattern> patterns = new ArrayList<>();
        for (Node node : Nodes.preOrder(tree)) {
            if (!(node instanceof Operator op) || !op.isMultiplication()) {
                continue;
            }
            Node other = op.left() instanceof Constant ? op.right() : op.left();
            Constant coefficient = redundantCoefficient(op);
            if (coefficient == null || other instanceof Constant) {
                continue;
            }
            String replacement;
            if (coefficient.hasValue(0)) {
                replacement = "0";
            } else if (coefficient.hasValue(1)) {
                replacement = other.toString();
            } else {
                replacement = Operator.negate(other).toString();
            }
            patterns.add(new SimplificationPattern(PatternKind.COEFFICIENT_NORMALIZATION,
                    "Redundant coefficient " + coefficient + ": " + op,
                    List.of(op),
                    "write " + op + " as " + replacement));
        }
        return patterns;
    }

    private boolean hasUnsimplifiedOperations(Node tree) {
        for (Node node : Nodes.preOrder(tree)) {
            if (node instanceof Operator op) {
                if (isReducibleConstantOperation(op)) {
                    return true;
                }
                if (op.isMultiplication() && (isUnitCoefficient(op.left()) || isUnitCoefficient(op.right()))) {
                    return true;
                }
            }
        }
        return false;
    }

    // --- HELPERS ---

    private boolean isReducibleConstantOperation(Operator op) {
        boolean allConstant = op.args().stream().allMatch(arg -> Nodes.unwrap(arg) instanceof Constant);
        return allConstant && !algebraBackend.simplify(op).toString().equals(op.toString());
    }

    private static boolean isUnitCoefficient(Node node) {
        return node instanceof Constant constant && (constant.hasValue(1) || constant.hasValue(-1));
    }

    private static Constant redundantCoefficient(Operator product) {
        for (Node operand : product.args()) {
            if (operand instanceof Constant constant
                    && (constant.hasValue(0) || constant.hasValue(1) || constant.hasValue(-1))) {
                return constant;
            }
        }
        return null;
    }

    private static boolean isSum(Node node) {
        return Nodes.unwrap(node) instanceof Operator op && op.isAdditive();
    }

    /**
     * The part of a term that decides whether it can be combined with another term.
     */
    private static String signature(Node term) {
        if (Nodes.isConstantExpression(term)) {
            return CONSTANT_SIGNATURE;
        }
        Node node = Nodes.unwrap(term);
        if (node instanceof Symbol symbol) {
            return symbol.name();
        }
        if (node instanceof Operator op && op.isMultiplication()) {
            return Nodes.factors(op).stream()
                    .filter(factor -> !Nodes.isConstantExpression(factor))
                    .map(Node::toString)
                    .sorted()
                    .collect(Collectors.joining("*"));
        }
        if (node instanceof Operator op && op.isDivision() && Nodes.isConstantExpression(op.right())) {
            return signature(op.left());
        }
        return term.toString();
    }

    private static Node rebuild(List<SignedTerm> terms) {
        Node result = null;
        for (SignedTerm term : terms) {
            if (result == null) {
                result = term.negative() ? Operator.negate(term.term()) : term.term();
            } else {
                result = Operator.binary(term.negative() ? Operator.SUBTRACT : Operator.ADD, result, term.term());
            }
        }
        return result;
    }

    // --- STRING COMPARISON ---

    private boolean sideIsSimplified(String expression) {
        String simplified = algebraBackend.simplify(algebraBackend.parse(expression)).toString();
        if (expression.equals(simplified)) {
            return true;
        }
        String original = COSMETIC.matcher(expression).replaceAll("");
        String reduced = COSMETIC.matcher(simplified).replaceAll("");
        if (original.equals(reduced)) {
            return true;
        }
        return sortedTerms(original).equals(sortedTerms(reduced));
    }

    /**
     * Splits a whitespace-free expression into signed top-level terms and sorts them.
     */
    static List<String> sortedTerms(String compact) {
        List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            boolean separator = (c == '+' || c == '-') && depth == 0 && i > 0
                    && "+-/^(".indexOf(compact.charAt(i - 1)) < 0;
            if (separator) {
                terms.add(signed(current.toString()));
                current.setLength(0);
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
            current.append(c);
        }
        terms.add(signed(current.toString()));
        terms.sort(null);
        return terms;
    }

    private static String signed(String term) {
        return term.startsWith("+") || term.startsWith("-") ? term : "+" + term;
    }
}
