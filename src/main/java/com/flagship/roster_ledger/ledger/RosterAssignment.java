package com.flagship.roster_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of the ownership ledger: a player held by a team within a league.
 *
 * Rows are created by an acquire and deleted by a release; they are never
 * updated in place.
 */
@Value
public class RosterAssignment {
    UUID leagueId;
    UUID teamId;
    String playerId;
    Instant acquiredAt;
}
