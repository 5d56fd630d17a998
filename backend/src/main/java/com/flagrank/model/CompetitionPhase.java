package com.flagrank.model;

public enum CompetitionPhase {
    UPCOMING,
    ACTIVE,
    FINISHED
}
