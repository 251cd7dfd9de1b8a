package com.flagship.roster_ledger.move.event;

import com.flagship.roster_ledger.move.AppliedMove;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A player left a team's roster and entered waivers.
 */
@Value
public class PlayerDroppedEvent implements RosterEvent {
    UUID eventId;
    UUID leagueId;
    UUID teamId;
    UUID userId;
    String playerId;
    String source;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PlayerDropped";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PlayerDroppedEvent from(AppliedMove move) {
        return new PlayerDroppedEvent(
            UUID.randomUUID(),
            move.getLeagueId(),
            move.getTeamId(),
            move.getUserId(),
            move.getReleasedPlayerId(),
            move.getSource(),
            move.getAppliedAt()
        );
    }
}
