package com.flagship.roster_ledger.waiver;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LeagueProcessingStatus {
    UUID leagueId;
    long pendingClaims;
    /** Null if no claim of the league has been processed yet. */
    Instant lastProcessedAt;
    Instant nextProcessingAt;
}
