package com.flagship.roster_ledger.ledger;

/**
 * Result of a non-blocking ownership probe.
 */
public enum OwnershipProbe {

    /** No team holds the player. */
    FREE,

    /** A committed row exists and this transaction now holds its lock. */
    OWNED,

    /** A row exists but another transaction currently holds its lock. */
    CONTENDED;

    public boolean isFree() {
        return this == FREE;
    }
}
