package com.flagship.roster_ledger.move;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A move the engine applied. Only visible to others once the surrounding
 * transaction commits.
 */
@Value
public class AppliedMove {
    UUID leagueId;
    UUID teamId;
    UUID userId;
    String releasedPlayerId;
    String acquiredPlayerId;
    String source;
    Instant appliedAt;

    public boolean released() {
        return releasedPlayerId != null;
    }

    public boolean acquired() {
        return acquiredPlayerId != null;
    }
}
