package com.flagship.roster_ledger.audit;

/**
 * Error code stored with every failed attempt.
 */
public enum FailureCategory {
    DUPLICATE_PLAYER,
    ROSTER_FULL,
    NOT_OWNED,
    NO_TEAM,
    ON_COOLDOWN,
    ALREADY_ROSTERED,
    VALIDATION,
    UNEXPECTED
}
