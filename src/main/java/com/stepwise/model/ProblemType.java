package com.stepwise.model;

public enum ProblemType {
    SOLVE_EQUATION,
    SIMPLIFY_EXPRESSION
}
