package com.stepwise.service.api;

import com.stepwise.model.ValidationContext;

import java.util.List;

/**
 * Produces short, learner-facing hints from the pattern analysis of an input.
 */
public interface HintService {

    /**
     * Builds hints for the current input of {@code context}.
     *
     * @param context The current context; only {@code studentInput} is analysed.
     * @return One hint per detected pattern, or a general hint. Never empty.
     */
    List<String> generateContextualHints(ValidationContext context);

    /**
     * @param expression An expression or equation.
     * @return {@code true} if the analysis finds anything left to simplify.
     */
    boolean needsSimplification(String expression);

    /**
     * @param expression An expression or equation.
     * @return One suggestion per detected pattern; empty if there is nothing to suggest.
     */
    List<String> getSimplificationSuggestions(String expression);
}
