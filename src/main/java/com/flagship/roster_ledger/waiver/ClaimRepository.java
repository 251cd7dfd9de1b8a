package com.flagship.roster_ledger.waiver;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClaimRepository extends JpaRepository<ClaimEntity, UUID> {

    Optional<ClaimEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<ClaimEntity> findByIdAndLeagueIdAndTeamId(UUID id, UUID leagueId, UUID teamId);

    List<ClaimEntity> findByLeagueIdAndTeamIdAndStatusOrderByCreatedAtAsc(UUID leagueId, UUID teamId,
                                                                          ClaimStatus status);

    /**
     * Cancels a claim only while it is still pending. Blocks behind a waiver
     * run holding the row; once that run commits the claim is terminal and
     * nothing is updated.
     *
     * @return 1 if cancelled, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ClaimEntity c SET c.status = com.flagship.roster_ledger.waiver.ClaimStatus.CANCELLED, " +
           "c.updatedAt = :now " +
           "WHERE c.id = :claimId AND c.leagueId = :leagueId AND c.teamId = :teamId " +
           "AND c.status = com.flagship.roster_ledger.waiver.ClaimStatus.PENDING")
    int cancelIfPending(@Param("claimId") UUID claimId,
                        @Param("leagueId") UUID leagueId,
                        @Param("teamId") UUID teamId,
                        @Param("now") Instant now);
}
