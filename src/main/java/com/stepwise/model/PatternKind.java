package com.stepwise.model;

/**
 * The kinds of "still simplifiable" structure the pattern detector reports.
 */
public enum PatternKind {
    CONSTANT_ARITHMETIC("You can simplify the arithmetic"),
    LIKE_TERMS("You can combine like terms"),
    DISTRIBUTIVE("You can use the distributive property"),
    COEFFICIENT_NORMALIZATION("You can simplify the coefficient");

    private final String feedbackPrefix;

    PatternKind(String feedbackPrefix) {
        this.feedbackPrefix = feedbackPrefix;
    }

    /**
     * @return The opening of the sentence shown to the learner, completed by the pattern's suggestion.
     */
    public String feedbackPrefix() {
        return feedbackPrefix;
    }
}
