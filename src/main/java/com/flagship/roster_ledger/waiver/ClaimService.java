package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.observability.RosterMetrics;
import com.flagship.roster_ledger.priority.PriorityRank;
import com.flagship.roster_ledger.priority.PriorityRotationTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Files, cancels and reads waiver claims. Resolving them is
 * {@link ClaimProcessor}'s job.
 */
@Service
@Slf4j
public class ClaimService {

    private final ClaimRepository claimRepository;
    private final IdempotencyService idempotencyService;
    private final LeagueDirectory leagueDirectory;
    private final PriorityRotationTable priorityTable;
    private final RosterMetrics rosterMetrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ClaimService(ClaimRepository claimRepository,
                        IdempotencyService idempotencyService,
                        LeagueDirectory leagueDirectory,
                        PriorityRotationTable priorityTable,
                        RosterMetrics rosterMetrics,
                        PlatformTransactionManager transactionManager,
                        Clock clock) {
        this.claimRepository = claimRepository;
        this.idempotencyService = idempotencyService;
        this.leagueDirectory = leagueDirectory;
        this.priorityTable = priorityTable;
        this.rosterMetrics = rosterMetrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Files a pending claim with a snapshot of the team's current rank.
     *
     * With an idempotency key, a repeated submission returns the claim filed
     * first. Two concurrent first submissions are settled by the unique
     * constraint on the key: the loser re-reads and returns the winner's claim.
     * A key is only ever replayed to the league and team that first used it.
     *
     * @throws IllegalArgumentException if the team is not in the league, the players are invalid,
     *                                  or the key was used by another team
     * @throws IllegalStateException    if the team has no waiver priority yet
     */
    public SubmittedClaim submitClaim(UUID leagueId, UUID teamId, String playerId,
                                      String dropPlayerId, String idempotencyKey) {
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();

        if (keyed) {
            Optional<SubmittedClaim> replay = replay(idempotencyKey, leagueId, teamId);
            if (replay.isPresent()) {
                rosterMetrics.recordIdempotencyHit();
                rosterMetrics.recordClaimSubmitted("replayed");
                return replay.get();
            }
            rosterMetrics.recordIdempotencyMiss();
        }

        if (!leagueDirectory.teamBelongsToLeague(leagueId, teamId)) {
            rosterMetrics.recordClaimSubmitted("rejected");
            throw new IllegalArgumentException("Team " + teamId + " does not belong to league " + leagueId);
        }
        PriorityRank rank = priorityTable.findRank(leagueId, teamId)
                .orElseThrow(() -> {
                    rosterMetrics.recordClaimSubmitted("rejected");
                    return new IllegalStateException("Team " + teamId + " has no waiver priority in this league");
                });

        Claim claim = Claim.submit(UUID.randomUUID(), leagueId, teamId, playerId, dropPlayerId,
                rank.getRank(), clock.instant());

        try {
            Claim saved = transactionTemplate.execute(status ->
                    claimRepository.saveAndFlush(ClaimEntity.fromDomain(claim, keyed ? idempotencyKey : null))
                            .toDomain());
            if (keyed) {
                idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());
            }
            rosterMetrics.recordClaimSubmitted("created");
            log.info("Waiver claim submitted: claimId={}, teamId={}, playerId={}, dropPlayerId={}, priority={}",
                    saved.getId(), teamId, saved.getPlayerId(), saved.getDropPlayerId(), saved.getPriority());
            return new SubmittedClaim(saved, true);

        } catch (DataIntegrityViolationException e) {
            if (keyed) {
                Optional<SubmittedClaim> replay = replay(idempotencyKey, leagueId, teamId);
                if (replay.isPresent()) {
                    log.info("Concurrent submission with the same idempotency key, returning existing claim");
                    rosterMetrics.recordClaimSubmitted("replayed");
                    return replay.get();
                }
            }
            throw e;
        }
    }

    /**
     * Cancels a pending claim. A claim that a waiver run already resolved is
     * reported as {@link CancelResult#ALREADY_FINAL}.
     */
    @Transactional
    public CancelResult cancelClaim(UUID leagueId, UUID teamId, UUID claimId) {
        int updated = claimRepository.cancelIfPending(claimId, leagueId, teamId, clock.instant());
        if (updated == 1) {
            log.info("Waiver claim cancelled: claimId={}, teamId={}", claimId, teamId);
            return CancelResult.CANCELLED;
        }
        return claimRepository.findByIdAndLeagueIdAndTeamId(claimId, leagueId, teamId)
                .map(existing -> {
                    log.info("Cancel ignored, claim {} is already {}", claimId, existing.getStatus());
                    return CancelResult.ALREADY_FINAL;
                })
                .orElse(CancelResult.NOT_FOUND);
    }

    @Transactional(readOnly = true)
    public List<Claim> findPendingClaims(UUID leagueId, UUID teamId) {
        return claimRepository
                .findByLeagueIdAndTeamIdAndStatusOrderByCreatedAtAsc(leagueId, teamId, ClaimStatus.PENDING)
                .stream()
                .map(ClaimEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Claim> findClaim(UUID claimId) {
        return claimRepository.findById(claimId).map(ClaimEntity::toDomain);
    }

    private Optional<SubmittedClaim> replay(String idempotencyKey, UUID leagueId, UUID teamId) {
        Optional<Claim> existing = idempotencyService.checkIdempotencyKey(idempotencyKey).flatMap(this::findClaim);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Claim claim = existing.get();
        if (!claim.getLeagueId().equals(leagueId) || !claim.getTeamId().equals(teamId)) {
            log.warn("Idempotency key reused by another team: claimId={}, requestedTeamId={}", claim.getId(), teamId);
            rosterMetrics.recordClaimSubmitted("rejected");
            throw new IllegalArgumentException("Idempotency key was already used for a claim of another team");
        }
        log.info("Idempotency key already used, returning existing claim {}", claim.getId());
        return Optional.of(new SubmittedClaim(claim, false));
    }
}
