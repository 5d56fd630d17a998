package com.flagrank.model;

public enum Capability {
    SUBMIT_FLAG,
    UNLOCK_HINT,
    CLAIM_KOTH,
    VIEW_TEAM_SCORE,
    VIEW_SCOREBOARD,
    VIEW_LIVE_SCOREBOARD,
    RECONCILE_SCORES,
    CLOSE_COMPETITION,
    MANAGE_COMPETITION
}
