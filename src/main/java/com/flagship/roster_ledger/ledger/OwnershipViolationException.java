package com.flagship.roster_ledger.ledger;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised by {@link OwnershipLedger} when a write would break ownership rules.
 */
@Getter
public class OwnershipViolationException extends RuntimeException {

    public enum Kind {
        /** The player already belongs to a team in the league. */
        ALREADY_OWNED,
        /** The releasing team does not hold the player. */
        NOT_OWNED
    }

    private final Kind kind;
    private final UUID leagueId;
    private final String playerId;

    public OwnershipViolationException(Kind kind, UUID leagueId, String playerId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.leagueId = leagueId;
        this.playerId = playerId;
    }

    public static OwnershipViolationException alreadyOwned(UUID leagueId, String playerId, Throwable cause) {
        return new OwnershipViolationException(Kind.ALREADY_OWNED, leagueId, playerId,
                String.format("Player %s is already rostered in league %s", playerId, leagueId), cause);
    }

    public static OwnershipViolationException notOwned(UUID leagueId, UUID teamId, String playerId) {
        return new OwnershipViolationException(Kind.NOT_OWNED, leagueId, playerId,
                String.format("Player %s is not on the roster of team %s", playerId, teamId), null);
    }
}
