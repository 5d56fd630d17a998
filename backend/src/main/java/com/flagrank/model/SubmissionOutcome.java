package com.flagrank.model;

/**
 * Outcome stored on every submission row. Only {@code CORRECT} rows carry a solve key and a value.
 */
public enum SubmissionOutcome {
    CORRECT,
    INCORRECT,
    ALREADY_SOLVED
}
