package com.flagrank.model;

public enum ChallengeScoringType {
    STATIC,
    DYNAMIC
}
