package com.flagship.roster_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one ownership change.
 * Sequence numbers are assigned by the database and give a total order per table.
 */
@Value
public class TransactionLedgerEntry {
    UUID id;
    UUID leagueId;
    UUID teamId;
    UUID userId;
    TransactionType type;
    String playerId;
    String source;
    Instant createdAt;
    long sequenceNumber;
}
