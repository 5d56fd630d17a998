package com.flagrank.model;

public enum KothTargetStatus {
    OPEN,
    CLOSED
}
