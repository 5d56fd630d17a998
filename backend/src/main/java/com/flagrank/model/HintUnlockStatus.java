package com.flagrank.model;

public enum HintUnlockStatus {
    UNLOCKED,
    ALREADY_UNLOCKED,
    OUT_OF_ORDER
}
