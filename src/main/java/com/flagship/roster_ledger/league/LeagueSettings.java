package com.flagship.roster_ledger.league;

import com.flagship.roster_ledger.waiver.WaiverPolicy;
import lombok.Value;

import java.time.Duration;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Read model of the league settings the ledger depends on.
 */
@Value
public class LeagueSettings {

    public static final int DEFAULT_ROSTER_SIZE = 20;
    public static final int DEFAULT_IR_SLOTS = 3;
    public static final LocalTime DEFAULT_PROCESS_TIME = LocalTime.of(3, 0);

    UUID leagueId;
    int rosterSize;
    int irSlots;
    WaiverPolicy waiverPolicy;
    Duration cooldown;
    LocalTime processTime;

    /**
     * Hard cap on ledger rows per team: active roster plus injured-reserve slots.
     */
    public int maxRosterSize() {
        return rosterSize + irSlots;
    }

    public static LeagueSettings defaults(UUID leagueId, Duration cooldown) {
        return new LeagueSettings(leagueId, DEFAULT_ROSTER_SIZE, DEFAULT_IR_SLOTS,
                WaiverPolicy.ROTATING, cooldown, DEFAULT_PROCESS_TIME);
    }
}
