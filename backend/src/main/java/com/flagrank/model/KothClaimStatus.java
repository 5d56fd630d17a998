package com.flagrank.model;

/**
 * Claim outcomes. {@code CONTESTED}, {@code REJECTED} and {@code CLOSED} leave ownership unchanged for the caller.
 */
public enum KothClaimStatus {
    CLAIMED,
    ALREADY_OWNER,
    CONTESTED,
    REJECTED,
    CLOSED
}
