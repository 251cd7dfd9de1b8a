package com.flagship.roster_ledger.waiver.event;

import com.flagship.roster_ledger.move.event.RosterEvent;
import com.flagship.roster_ledger.waiver.ClaimOutcome;
import com.flagship.roster_ledger.waiver.ClaimStatus;
import com.flagship.roster_ledger.waiver.PendingClaim;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A waiver claim was resolved, either way.
 */
@Value
public class ClaimProcessedEvent implements RosterEvent {
    UUID eventId;
    UUID claimId;
    UUID leagueId;
    UUID teamId;
    String playerId;
    String dropPlayerId;
    ClaimStatus status;
    String failureReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimProcessed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimProcessedEvent from(PendingClaim claim, ClaimOutcome outcome, Instant occurredAt) {
        return new ClaimProcessedEvent(
            UUID.randomUUID(),
            claim.getClaimId(),
            claim.getLeagueId(),
            claim.getTeamId(),
            claim.getPlayerId(),
            claim.getDropPlayerId(),
            outcome.getStatus(),
            outcome.getReason(),
            occurredAt
        );
    }
}
