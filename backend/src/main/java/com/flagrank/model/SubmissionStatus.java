package com.flagrank.model;

public enum SubmissionStatus {
    ACCEPTED,
    ALREADY_SOLVED,
    INCORRECT
}
