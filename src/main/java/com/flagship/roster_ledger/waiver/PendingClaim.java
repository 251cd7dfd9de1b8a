package com.flagship.roster_ledger.waiver;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A pending claim as seen by the batch processor, joined with the requesting
 * team's current priority rank.
 */
@Value
public class PendingClaim {
    UUID claimId;
    UUID leagueId;
    UUID teamId;
    String playerId;
    String dropPlayerId;
    int teamRank;
    Instant createdAt;

    public boolean hasDropPlayer() {
        return dropPlayerId != null;
    }
}
