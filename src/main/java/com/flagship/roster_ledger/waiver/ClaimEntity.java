package com.flagship.roster_ledger.waiver;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code waiver_claims}.
 *
 * Only inserts and reads go through JPA. Status changes are conditional
 * updates ({@link ClaimRepository#cancelIfPending}, {@link ClaimBatchRepository})
 * so a concurrent cancel and a waiver run cannot overwrite each other.
 */
@Entity
@Table(name = "waiver_claims")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClaimEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "league_id", nullable = false, updatable = false)
    private UUID leagueId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "player_id", nullable = false, updatable = false, length = 64)
    private String playerId;

    @Column(name = "drop_player_id", updatable = false, length = 64)
    private String dropPlayerId;

    @Column(nullable = false, updatable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ClaimStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * The idempotency key is a persistence concern and is passed separately.
     */
    static ClaimEntity fromDomain(Claim claim, String idempotencyKey) {
        return new ClaimEntity(
            claim.getId(),
            claim.getLeagueId(),
            claim.getTeamId(),
            claim.getPlayerId(),
            claim.getDropPlayerId(),
            claim.getPriority(),
            claim.getStatus(),
            claim.getFailureReason(),
            idempotencyKey,
            claim.getCreatedAt(),
            claim.getUpdatedAt(),
            claim.getProcessedAt()
        );
    }

    public Claim toDomain() {
        return new Claim(
            id,
            leagueId,
            teamId,
            playerId,
            dropPlayerId,
            priority,
            status,
            failureReason,
            createdAt,
            updatedAt,
            processedAt
        );
    }
}
