package io.jobplan4j.core;

public enum SolverType {
    LIST,
    GENETIC,
    BACKTRACKING
}
