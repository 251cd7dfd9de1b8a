package com.flagship.roster_ledger.expiry;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Cooldown window opened when a player is released.
 * {@code clearedAt} is null while the window is open.
 */
@Value
public class ExpiryWindow {
    UUID id;
    UUID leagueId;
    String playerId;
    Instant openedAt;
    Instant clearedAt;
    UUID releasedByTeamId;

    public boolean isOpen() {
        return clearedAt == null;
    }

    public Instant clearsAt(Duration cooldown) {
        return openedAt.plus(cooldown);
    }

    public boolean hasElapsed(Duration cooldown, Instant now) {
        return !now.isBefore(clearsAt(cooldown));
    }
}
