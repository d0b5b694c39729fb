package com.stepwise.model;

/**
 * The six ways a submitted step can be classified. Only the {@code CORRECT_*} outcomes let the
 * learner advance.
 */
public enum OutcomeCode {
    CORRECT_FINAL_STEP(true),
    CORRECT_INTERMEDIATE_STEP(true),
    CORRECT_BUT_NOT_SIMPLIFIED(true),
    VALID_BUT_NO_PROGRESS(false),
    EQUIVALENCE_FAILURE(false),
    PARSING_ERROR(false);

    private final boolean correct;

    OutcomeCode(boolean correct) {
        this.correct = correct;
    }

    public boolean isCorrect() {
        return correct;
    }
}
