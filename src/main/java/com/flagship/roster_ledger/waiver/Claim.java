package com.flagship.roster_ledger.waiver;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A team's request to acquire a player through the waiver queue, optionally
 * dropping one of its own players if the claim succeeds.
 *
 * Immutable: every transition returns a new instance. {@code priority} is the
 * team's rank when the claim was filed; processing uses the live rank.
 */
@Value
public class Claim {
    UUID id;
    UUID leagueId;
    UUID teamId;
    String playerId;
    String dropPlayerId;
    int priority;
    ClaimStatus status;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;
    Instant processedAt;

    public static Claim submit(UUID id, UUID leagueId, UUID teamId, String playerId,
                               String dropPlayerId, int priority, Instant now) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player to claim is required");
        }
        String drop = dropPlayerId == null || dropPlayerId.isBlank() ? null : dropPlayerId.trim();
        if (playerId.trim().equals(drop)) {
            throw new IllegalArgumentException("Cannot claim and drop the same player");
        }
        return new Claim(id, leagueId, teamId, playerId.trim(), drop, priority,
                ClaimStatus.PENDING, null, now, now, null);
    }

    /**
     * @throws IllegalStateException if the claim is no longer pending
     */
    public Claim succeed(Instant now) {
        requirePending("succeed");
        return withStatus(ClaimStatus.SUCCESSFUL, null, now, now);
    }

    /**
     * @throws IllegalStateException if the claim is no longer pending
     */
    public Claim fail(String reason, Instant now) {
        requirePending("fail");
        return withStatus(ClaimStatus.FAILED, reason, now, now);
    }

    /**
     * @throws IllegalStateException if the claim is no longer pending
     */
    public Claim cancel(Instant now) {
        requirePending("cancel");
        return withStatus(ClaimStatus.CANCELLED, null, now, null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasDropPlayer() {
        return dropPlayerId != null;
    }

    public boolean canTransitionTo(ClaimStatus target) {
        if (status == target) {
            return true;
        }
        return status == ClaimStatus.PENDING;
    }

    private void requirePending(String action) {
        if (status != ClaimStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot %s claim %s in %s status. Only PENDING claims can change.",
                    action, id, status));
        }
    }

    private Claim withStatus(ClaimStatus newStatus, String reason, Instant now, Instant processed) {
        return new Claim(id, leagueId, teamId, playerId, dropPlayerId, priority,
                newStatus, reason, createdAt, now, processed);
    }
}
