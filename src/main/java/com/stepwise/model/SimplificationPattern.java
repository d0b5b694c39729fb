package com.stepwise.model;

import com.stepwise.algebra.Node;

import java.util.List;

/**
 * A sub-structure of an expression that could still be simplified.
 *
 * @param kind           What sort of simplification is available.
 * @param description    A technical description, used in logs.
 * @param affectedNodes  The nodes the pattern was found on.
 * @param suggestionText What the learner could do, e.g. {@code 9 / 3 becomes 3}.
 */
public record SimplificationPattern(PatternKind kind, String description, List<Node> affectedNodes, String suggestionText) {

    public SimplificationPattern {
        affectedNodes = List.copyOf(affectedNodes);
    }

    /**
     * @return The full learner-facing sentence for this pattern.
     */
    public String feedback() {
        return kind.feedbackPrefix() + ": " + suggestionText;
    }
}
