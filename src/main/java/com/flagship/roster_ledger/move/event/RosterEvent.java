package com.flagship.roster_ledger.move.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events published for roster changes.
 */
public interface RosterEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * The league the change happened in. Also the Kafka key.
     */
    UUID getLeagueId();

    Instant getOccurredAt();

    String getEventType();
}
