package com.flagship.roster_ledger.move;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A resolved move handed to {@link RosterMoveEngine}: the team is known, the
 * player ids are normalized and the league cap is attached.
 */
@Value
@Builder
public class MoveCommand {
    UUID leagueId;
    UUID teamId;
    UUID userId;
    String releasePlayerId;
    String acquirePlayerId;
    String source;
    int maxRosterSize;
    /** Direct moves may not take players inside a waiver window; claims may. */
    boolean enforceCooldown;
}
