package com.stepwise.service.impl;

import com.stepwise.algebra.Constant;
import com.stepwise.algebra.Node;
import com.stepwise.algebra.Nodes;
import com.stepwise.model.CanonicalForm;
import com.stepwise.model.ParsedInput;
import com.stepwise.service.api.AlgebraBackend;
import com.stepwise.service.api.Canonicalizer;
import com.stepwise.service.api.EquivalenceChecker;
import com.stepwise.service.api.InputSyntaxValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link EquivalenceChecker}.
 * <p>
 * Equations are compared through their canonical forms, so two equations are equivalent when their
 * sides differ by the same expression up to sign; {@code 2x = 6} and {@code x = 3} have the same
 * solution but are not the same step. Plain expressions are compared directly.
 * </p>
 * <p>
 * When neither structural equality nor symbolic simplification settles the question, the difference
 * is evaluated at {@link #SAMPLE_POINTS}. With several variables, the k-th variable in alphabetical order
 * is bound to {@code point + k * 1.5} so that no two variables share a value.
 * </p>
 */
@Service
public class EquivalenceCheckerImpl implements EquivalenceChecker {

    private static final Logger log = LoggerFactory.getLogger(EquivalenceCheckerImpl.class);

    static final double[] SAMPLE_POINTS = {0, 1, 2, -1, 5, 10};
    static final double TOLERANCE = 1e-10;
    private static final double VARIABLE_OFFSET = 1.5;

    private final InputSyntaxValidator inputSyntaxValidator;
    private final Canonicalizer canonicalizer;
    private final AlgebraBackend algebraBackend;

    public EquivalenceCheckerImpl(InputSyntaxValidator inputSyntaxValidator,
                                  Canonicalizer canonicalizer,
                                  AlgebraBackend algebraBackend) {
        this.inputSyntaxValidator = inputSyntaxValidator;
        this.canonicalizer = canonicalizer;
        this.algebraBackend = algebraBackend;
    }

    @Override
    public boolean areEquivalent(String a, String b) {
        try {
            ParsedInput first = inputSyntaxValidator.validate(a);
            ParsedInput second = inputSyntaxValidator.validate(b);
            if (first.isEquation() || second.isEquation()) {
                return canonicalFormsEquivalent(canonicalizer.canonicalize(a), canonicalizer.canonicalize(b));
            }
            Node left = algebraBackend.parse(first.trimmed());
            Node right = algebraBackend.parse(second.trimmed());
            return left.equals(right) || differenceVanishes(first.trimmed(), second.trimmed());
        } catch (RuntimeException e) {
            log.debug("Treating '{}' and '{}' as not equivalent: {}", a, b, e.getMessage());
            return false;
        }
    }

    private boolean canonicalFormsEquivalent(CanonicalForm first, CanonicalForm second) {
        if (first.tree().equals(second.tree())) {
            return true;
        }
        if (first.degraded() || second.degraded()) {
            log.debug("Comparing degraded canonical forms '{}' and '{}'", first, second);
        }
        return differenceVanishes(first.toString(), second.toString());
    }

    private boolean differenceVanishes(String first, String second) {
        Node difference = algebraBackend.simplify(algebraBackend.parse("(" + first + ") - (" + second + ")"));
        if ("0".equals(difference.toString()) || Constant.ZERO.equals(difference)) {
            return true;
        }
        return vanishesAtSamplePoints(difference);
    }

    private boolean vanishesAtSamplePoints(Node difference) {
        List<String> variables = new ArrayList<>(Nodes.variables(difference));
        if (variables.isEmpty()) {
            return isNegligible(difference, Map.of());
        }
        for (double point : SAMPLE_POINTS) {
            Map<String, Double> bindings = new HashMap<>();
            for (int k = 0; k < variables.size(); k++) {
                bindings.put(variables.get(k), point + k * VARIABLE_OFFSET);
            }
            if (!isNegligible(difference, bindings)) {
                return false;
            }
        }
        log.debug("'{}' vanishes at every sample point", difference);
        return true;
    }

    private boolean isNegligible(Node difference, Map<String, Double> bindings) {
        try {
            return Math.abs(algebraBackend.evaluate(difference, bindings)) < TOLERANCE;
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.debug("Sample point {} undefined for '{}': {}", bindings, difference, e.getMessage());
            return false;
        }
    }
}
