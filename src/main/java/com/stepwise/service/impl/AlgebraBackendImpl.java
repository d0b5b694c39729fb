package com.stepwise.service.impl;

import com.stepwise.algebra.Evaluator;
import com.stepwise.algebra.ExpressionParser;
import com.stepwise.algebra.Node;
import com.stepwise.algebra.Simplifier;
import com.stepwise.service.api.AlgebraBackend;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * In-process {@link AlgebraBackend} built on the recursive-descent parser and the rational
 * polynomial simplifier of the {@code algebra} package.
 */
@Service
public class AlgebraBackendImpl implements AlgebraBackend {

    private final Simplifier simplifier = new Simplifier();

    @Override
    public Node parse(String text) {
        return ExpressionParser.parse(text);
    }

    @Override
    public Node simplify(Node tree) {
        return simplifier.simplify(tree);
    }

    @Override
    public Node expand(Node tree) {
        return simplifier.expand(tree);
    }

    @Override
    public double evaluate(Node tree, Map<String, Double> bindings) {
        return Evaluator.evaluate(tree, bindings);
    }
}
