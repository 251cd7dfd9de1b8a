package com.flagship.roster_ledger.waiver;

/**
 * Outcome of a cancel request.
 */
public enum CancelResult {
    /** The claim was pending and is now cancelled. */
    CANCELLED,
    /** The claim was already resolved or cancelled; nothing changed. */
    ALREADY_FINAL,
    /** No such claim for this team and league. */
    NOT_FOUND
}
