package com.stepwise.algebra;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A sum of terms, each a rational coefficient times a product of factors raised to integer powers.
 * <p>
 * A factor base is any tree the simplifier cannot break down further: a variable, an unexpanded
 * sum, or an opaque operation such as {@code sqrt(x)}. Factors are keyed by their rendered text,
 * which makes like-term detection a map lookup.
 * </p>
 */
final class Polynomial {

    record Factor(Node base, int exponent) {}

    record Term(Rational coefficient, SortedMap<String, Factor> factors) {

        Term {
            factors = Collections.unmodifiableSortedMap(new TreeMap<>(factors));
        }

        static Term constant(Rational value) {
            return new Term(value, new TreeMap<>());
        }

        static Term of(Node base, int exponent) {
            var factors = new TreeMap<String, Factor>();
            factors.put(base.toString(), new Factor(base, exponent));
            return new Term(Rational.ONE, factors);
        }

        boolean isConstant() {
            return factors.isEmpty();
        }

        String signature() {
            return factors.entrySet().stream()
                    .map(e -> e.getKey() + "^" + e.getValue().exponent())
                    .collect(Collectors.joining("*"));
        }

        Term multiply(Term other) {
            var merged = new TreeMap<>(factors);
            other.factors.forEach((key, factor) -> {
                Factor existing = merged.get(key);
                int exponent = (existing == null ? 0 : existing.exponent()) + factor.exponent();
                if (exponent == 0) {
                    merged.remove(key);
                } else {
                    merged.put(key, new Factor(factor.base(), exponent));
                }
            });
            return new Term(coefficient.multiply(other.coefficient), merged);
        }

        Term pow(int exponent) {
            var raised = new TreeMap<String, Factor>();
            factors.forEach((key, factor) -> raised.put(key, new Factor(factor.base(), factor.exponent() * exponent)));
            return new Term(coefficient.pow(exponent), raised);
        }

        Term scale(Rational factor) {
            return new Term(coefficient.multiply(factor), factors);
        }
    }

    private static final Polynomial ZERO = new Polynomial(Map.of());

    private final Map<String, Term> terms;

    private Polynomial(Map<String, Term> terms) {
        this.terms = terms;
    }

    static Polynomial zero() {
        return ZERO;
    }

    static Polynomial constant(Rational value) {
        return of(Term.constant(value));
    }

    static Polynomial of(Term term) {
        if (term.coefficient().isZero()) {
            return ZERO;
        }
        var map = new LinkedHashMap<String, Term>();
        map.put(term.signature(), term);
        return new Polynomial(map);
    }

    Collection<Term> terms() {
        return terms.values();
    }

    boolean isZero() {
        return terms.isEmpty();
    }

    boolean isConstant() {
        return terms.isEmpty() || (terms.size() == 1 && singleTerm().isConstant());
    }

    Rational constantValue() {
        return terms.isEmpty() ? Rational.ZERO : singleTerm().coefficient();
    }

    boolean isSingleTerm() {
        return terms.size() == 1;
    }

    Term singleTerm() {
        return terms.values().iterator().next();
    }

    Polynomial add(Polynomial other) {
        var sum = new LinkedHashMap<>(terms);
        other.terms.forEach((signature, term) -> {
            Term existing = sum.get(signature);
            if (existing == null) {
                sum.put(signature, term);
                return;
            }
            Rational coefficient = existing.coefficient().add(term.coefficient());
            if (coefficient.isZero()) {
                sum.remove(signature);
            } else {
                sum.put(signature, new Term(coefficient, existing.factors()));
            }
        });
        return new Polynomial(sum);
    }

    Polynomial negate() {
        return scale(Rational.of(-1));
    }

    Polynomial scale(Rational factor) {
        if (factor.isZero()) {
            return ZERO;
        }
        var scaled = new LinkedHashMap<String, Term>();
        terms.forEach((signature, term) -> scaled.put(signature, term.scale(factor)));
        return new Polynomial(scaled);
    }

    /**
     * Multiplies every term of this polynomial by every term of {@code other}.
     */
    Polynomial multiply(Polynomial other) {
        Polynomial product = ZERO;
        for (Term left : terms.values()) {
            for (Term right : other.terms.values()) {
                product = product.add(of(left.multiply(right)));
            }
        }
        return product;
    }

    /**
     * @return The exponent as an {@code int} if this polynomial is an integer constant within {@code limit}.
     */
    Integer smallIntegerValue(int limit) {
        if (!isConstant()) {
            return null;
        }
        Rational value = constantValue();
        if (!value.isInteger() || value.numerator().abs().compareTo(BigInteger.valueOf(limit)) > 0) {
            return null;
        }
        return value.numerator().intValueExact();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Polynomial other && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }
}
