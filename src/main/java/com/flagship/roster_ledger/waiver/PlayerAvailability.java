package com.flagship.roster_ledger.waiver;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Whether a player can be added directly, must be claimed, or is taken.
 */
@Value
@Builder
public class PlayerAvailability {
    String playerId;
    boolean available;
    boolean rostered;
    UUID ownerTeamId;
    boolean onWaivers;
    Instant waiversClearAt;
    /** Human-readable reason when not available. */
    String lockReason;
}
