package com.flagship.roster_ledger.move;

import com.flagship.roster_ledger.audit.FailureCategory;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Result of {@link RosterMoveService#executeMove}. Rejections are results,
 * not exceptions; {@code reason} explains any non-success status.
 */
@Value
@Builder
public class MoveResult {
    MoveStatus status;
    String reason;
    /** Set for rejections; tells a malformed request apart from an internal failure. */
    FailureCategory failureCategory;
    UUID leagueId;
    UUID teamId;
    String releasedPlayerId;
    String acquiredPlayerId;
    long durationMs;

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
