package com.flagship.roster_ledger.priority;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A team's waiver rank within its league. Rank 1 is the best position under
 * the rotating policy.
 */
@Value
public class PriorityRank {
    UUID leagueId;
    UUID teamId;
    int rank;
    Instant updatedAt;
}
