package com.flagship.roster_ledger.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A rejected roster mutation.
 *
 * {@code teamId} is null when the caller had no team in the league.
 * {@code errorDetail} carries the raw underlying error for unexpected failures.
 */
@Value
@Builder
public class FailedAttempt {
    UUID leagueId;
    UUID teamId;
    UUID userId;
    MoveOperation operation;
    String playerId;
    FailureCategory category;
    String message;
    String errorDetail;
    Instant attemptedAt;
}
