package com.flagrank.model;

public enum ScoreEntryKind {
    SOLVE,
    HINT_UNLOCK,
    KOTH_ACCRUAL
}
