package com.flagship.roster_ledger.audit;

/**
 * Kind of ownership change recorded in the transaction log.
 */
public enum TransactionType {
    /** Player acquired by a team. */
    ADD,
    /** Player released by a team. */
    DROP,
    TRADE,
    DRAFT
}
