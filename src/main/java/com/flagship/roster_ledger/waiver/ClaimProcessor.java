package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.audit.FailedAttempt;
import com.flagship.roster_ledger.audit.FailureCategory;
import com.flagship.roster_ledger.audit.FailureSink;
import com.flagship.roster_ledger.audit.MoveOperation;
import com.flagship.roster_ledger.common.jdbc.SavepointTemplate;
import com.flagship.roster_ledger.expiry.ExpiryTracker;
import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.league.LeagueSettings;
import com.flagship.roster_ledger.ledger.OwnershipLedger;
import com.flagship.roster_ledger.ledger.OwnershipProbe;
import com.flagship.roster_ledger.lineup.LineupCache;
import com.flagship.roster_ledger.move.AppliedMove;
import com.flagship.roster_ledger.move.MoveCommand;
import com.flagship.roster_ledger.move.RosterMoveEngine;
import com.flagship.roster_ledger.move.RosterMoveException;
import com.flagship.roster_ledger.move.event.RosterEventRecorder;
import com.flagship.roster_ledger.observability.CorrelationContext;
import com.flagship.roster_ledger.observability.RosterMetrics;
import com.flagship.roster_ledger.outbox.OutboxService;
import com.flagship.roster_ledger.priority.PriorityRotationTable;
import com.flagship.roster_ledger.waiver.event.ClaimProcessedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a league's pending waiver claims in priority order.
 *
 * A run holds the league's advisory lock in an outer transaction for its
 * whole duration; a second run for the same league returns immediately with
 * no outcomes. The processing order is computed once at the start of the run.
 * Each claim then commits in its own transaction, so a later failure never
 * undoes an earlier claim.
 *
 * Within a claim's transaction the move engine runs inside a savepoint: an
 * engine rejection is rolled back to the savepoint and the claim is marked
 * failed in the same transaction.
 */
@Service
@Slf4j
public class ClaimProcessor {

    public static final String SOURCE_WAIVERS = "Waiver Processing";
    static final String EVENT_SOURCE = "WaiverClaim";

    private final ClaimBatchRepository batchRepository;
    private final LeagueDirectory leagueDirectory;
    private final OwnershipLedger ownershipLedger;
    private final LineupCache lineupCache;
    private final RosterMoveEngine moveEngine;
    private final SavepointTemplate savepointTemplate;
    private final PriorityRotationTable priorityTable;
    private final ExpiryTracker expiryTracker;
    private final RosterEventRecorder eventRecorder;
    private final OutboxService outboxService;
    private final FailureSink failureSink;
    private final RosterMetrics rosterMetrics;
    private final TransactionTemplate runTemplate;
    private final TransactionTemplate claimTemplate;
    private final Clock clock;

    public ClaimProcessor(ClaimBatchRepository batchRepository,
                          LeagueDirectory leagueDirectory,
                          OwnershipLedger ownershipLedger,
                          LineupCache lineupCache,
                          RosterMoveEngine moveEngine,
                          SavepointTemplate savepointTemplate,
                          PriorityRotationTable priorityTable,
                          ExpiryTracker expiryTracker,
                          RosterEventRecorder eventRecorder,
                          OutboxService outboxService,
                          FailureSink failureSink,
                          RosterMetrics rosterMetrics,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.batchRepository = batchRepository;
        this.leagueDirectory = leagueDirectory;
        this.ownershipLedger = ownershipLedger;
        this.lineupCache = lineupCache;
        this.moveEngine = moveEngine;
        this.savepointTemplate = savepointTemplate;
        this.priorityTable = priorityTable;
        this.expiryTracker = expiryTracker;
        this.eventRecorder = eventRecorder;
        this.outboxService = outboxService;
        this.failureSink = failureSink;
        this.rosterMetrics = rosterMetrics;
        this.runTemplate = new TransactionTemplate(transactionManager);
        this.runTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.claimTemplate = new TransactionTemplate(transactionManager);
        this.claimTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Processes up to {@code batchSize} pending claims of a league.
     *
     * @return one outcome per claim resolved in this run, in processing order;
     *         empty if another run holds the league or the league's policy
     *         cannot be processed. A storage failure ends the run early and
     *         returns the outcomes committed before it.
     */
    public List<ClaimOutcome> processClaims(UUID leagueId, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }

        long startTime = System.currentTimeMillis();
        CorrelationContext.putLeague(leagueId);
        List<ClaimOutcome> outcomes = new ArrayList<>();
        try {
            LeagueSettings settings = leagueDirectory.getSettings(leagueId);

            runTemplate.executeWithoutResult(status -> {
                if (!batchRepository.tryLockLeague(leagueId)) {
                    log.info("Waiver run already in progress for league, skipping");
                    rosterMetrics.recordRunSkipped("locked");
                    return;
                }

                Comparator<PendingClaim> order;
                try {
                    order = settings.getWaiverPolicy().processingOrder();
                } catch (UnsupportedOperationException e) {
                    log.warn("Skipping waiver run: {} (policy={})", e.getMessage(), settings.getWaiverPolicy());
                    rosterMetrics.recordRunSkipped("unsupported_policy");
                    return;
                }

                List<PendingClaim> batch = batchRepository.findPending(leagueId).stream()
                        .sorted(order)
                        .limit(batchSize)
                        .toList();
                log.info("Waiver run started: policy={}, claims={}", settings.getWaiverPolicy(), batch.size());

                processInOrder(settings, batch, outcomes);
            });

            long duration = System.currentTimeMillis() - startTime;
            long successful = outcomes.stream().filter(ClaimOutcome::isSuccessful).count();
            rosterMetrics.recordRun(outcomes.isEmpty() ? "empty" : "completed", Duration.ofMillis(duration));
            if (!outcomes.isEmpty()) {
                log.info("Waiver run finished: processed={}, successful={}, failed={}, duration={}ms",
                        outcomes.size(), successful, outcomes.size() - successful, duration);
            }
            return List.copyOf(outcomes);
        } catch (RuntimeException e) {
            // claims already resolved committed in their own transactions
            long duration = System.currentTimeMillis() - startTime;
            rosterMetrics.recordRun("error", Duration.ofMillis(duration));
            log.error("Waiver run aborted after {} claim(s): {}", outcomes.size(), e.getMessage(), e);
            return List.copyOf(outcomes);
        } finally {
            CorrelationContext.clearRosterKeys();
        }
    }

    private void processInOrder(LeagueSettings settings, List<PendingClaim> batch, List<ClaimOutcome> outcomes) {
        for (PendingClaim claim : batch) {
            CorrelationContext.putTeam(claim.getTeamId());
            CorrelationContext.putClaim(claim.getClaimId());
            try {
                Optional<ClaimOutcome> outcome = processIsolated(settings, claim);
                if (outcome.isEmpty()) {
                    continue;
                }
                outcomes.add(outcome.get());
                if (!outcome.get().isSuccessful()) {
                    recordFailure(claim, outcome.get());
                }
                rosterMetrics.recordClaimProcessed(outcome.get().getStatus().name().toLowerCase(Locale.ROOT));
            } catch (RuntimeException e) {
                log.error("Could not record failure of claim {}, abandoning the rest of the batch",
                        claim.getClaimId(), e);
                break;
            }
        }
    }

    /**
     * Runs one claim in its own transaction. An unexpected failure rolls that
     * transaction back and marks the claim failed in a fresh one; if that
     * also fails the exception propagates.
     */
    private Optional<ClaimOutcome> processIsolated(LeagueSettings settings, PendingClaim claim) {
        try {
            return claimTemplate.execute(status -> resolve(settings, claim));
        } catch (RuntimeException e) {
            log.error("Unexpected error processing claim {}", claim.getClaimId(), e);
            String reason = "Unexpected error: " + e.getMessage();
            return claimTemplate.execute(status -> batchRepository.lockClaim(claim.getClaimId())
                    .filter(current -> !current.isTerminal())
                    .map(current -> {
                        batchRepository.saveResolution(current.fail(reason, clock.instant()));
                        return ClaimOutcome.failed(claim, FailureCategory.UNEXPECTED, reason);
                    }));
        }
    }

    private Optional<ClaimOutcome> resolve(LeagueSettings settings, PendingClaim pending) {
        Optional<Claim> locked = batchRepository.lockClaim(pending.getClaimId());
        if (locked.isEmpty() || locked.get().isTerminal()) {
            log.info("Claim is no longer pending, skipping: status={}",
                    locked.map(c -> c.getStatus().name()).orElse("DELETED"));
            return Optional.empty();
        }
        Claim claim = locked.get();

        Optional<UUID> owner = leagueDirectory.findTeamOwner(pending.getTeamId());
        if (owner.isEmpty()) {
            return Optional.of(reject(claim, pending, FailureCategory.NO_TEAM, "Team has no owner"));
        }

        lineupCache.lockLineup(pending.getLeagueId(), pending.getTeamId());

        OwnershipProbe probe = ownershipLedger.probeOwnership(pending.getLeagueId(), pending.getPlayerId());
        if (!probe.isFree()) {
            return Optional.of(reject(claim, pending, FailureCategory.ALREADY_ROSTERED, "Player already rostered"));
        }

        if (!pending.hasDropPlayer()
                && ownershipLedger.countRoster(pending.getLeagueId(), pending.getTeamId()) >= settings.maxRosterSize()) {
            return Optional.of(reject(claim, pending, FailureCategory.ROSTER_FULL,
                    "Roster full - no drop player specified"));
        }

        MoveCommand command = MoveCommand.builder()
                .leagueId(pending.getLeagueId())
                .teamId(pending.getTeamId())
                .userId(owner.get())
                .releasePlayerId(pending.getDropPlayerId())
                .acquirePlayerId(pending.getPlayerId())
                .source(SOURCE_WAIVERS)
                .maxRosterSize(settings.maxRosterSize())
                .enforceCooldown(false)
                .build();

        AppliedMove applied;
        try {
            applied = savepointTemplate.execute("waiver_claim", () -> moveEngine.apply(command));
        } catch (RosterMoveException e) {
            return Optional.of(reject(claim, pending, e.getStatus().failureCategory(), e.getMessage()));
        }

        batchRepository.saveResolution(claim.succeed(clock.instant()));
        if (settings.getWaiverPolicy().rotatesOnSuccess()) {
            priorityTable.moveToBack(pending.getLeagueId(), pending.getTeamId());
        }
        expiryTracker.closeOpenWindow(pending.getLeagueId(), pending.getPlayerId());

        ClaimOutcome outcome = ClaimOutcome.successful(pending);
        eventRecorder.record(applied);
        outboxService.saveEvent(EVENT_SOURCE, pending.getLeagueId(), ClaimProcessedEvent.EVENT_TYPE,
                ClaimProcessedEvent.from(pending, outcome, clock.instant()));

        log.info("Claim successful: playerId={}, dropPlayerId={}", pending.getPlayerId(), pending.getDropPlayerId());
        return Optional.of(outcome);
    }

    private ClaimOutcome reject(Claim claim, PendingClaim pending, FailureCategory category, String reason) {
        batchRepository.saveResolution(claim.fail(reason, clock.instant()));
        ClaimOutcome outcome = ClaimOutcome.failed(pending, category, reason);
        outboxService.saveEvent(EVENT_SOURCE, pending.getLeagueId(), ClaimProcessedEvent.EVENT_TYPE,
                ClaimProcessedEvent.from(pending, outcome, clock.instant()));
        log.info("Claim failed: playerId={}, reason={}", pending.getPlayerId(), reason);
        return outcome;
    }

    private void recordFailure(PendingClaim claim, ClaimOutcome outcome) {
        failureSink.record(FailedAttempt.builder()
                .leagueId(claim.getLeagueId())
                .teamId(claim.getTeamId())
                .userId(leagueDirectory.findTeamOwner(claim.getTeamId()).orElse(null))
                .operation(MoveOperation.of(claim.getDropPlayerId(), claim.getPlayerId()))
                .playerId(claim.getPlayerId())
                .category(outcome.getFailureCategory())
                .message(outcome.getReason())
                .attemptedAt(clock.instant())
                .build());
    }
}
