package com.flagship.roster_ledger.move.event;

import com.flagship.roster_ledger.move.AppliedMove;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A player joined a team's roster.
 */
@Value
public class PlayerAddedEvent implements RosterEvent {
    UUID eventId;
    UUID leagueId;
    UUID teamId;
    UUID userId;
    String playerId;
    String source;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PlayerAdded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PlayerAddedEvent from(AppliedMove move) {
        return new PlayerAddedEvent(
            UUID.randomUUID(),
            move.getLeagueId(),
            move.getTeamId(),
            move.getUserId(),
            move.getAcquiredPlayerId(),
            move.getSource(),
            move.getAppliedAt()
        );
    }
}
