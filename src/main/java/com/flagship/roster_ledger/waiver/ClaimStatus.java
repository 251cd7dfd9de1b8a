package com.flagship.roster_ledger.waiver;

/**
 * Lifecycle of a waiver claim.
 *
 * PENDING is the only state that can change. The database trigger
 * {@code enforce_claim_lifecycle} rejects any update that moves a claim out
 * of a terminal state, so a late cancel cannot undo a processed claim.
 */
public enum ClaimStatus {
    /**
     * Waiting for the next waiver run. Can become SUCCESSFUL, FAILED or CANCELLED.
     */
    PENDING,

    /**
     * Resolved in the team's favour; the player was added to its roster.
     */
    SUCCESSFUL,

    /**
     * Resolved against the team. {@code failure_reason} says why.
     */
    FAILED,

    /**
     * Withdrawn by the team before it was processed.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
