package com.flagship.roster_ledger.move;

import com.flagship.roster_ledger.audit.FailedAttempt;
import com.flagship.roster_ledger.audit.FailureCategory;
import com.flagship.roster_ledger.audit.FailureSink;
import com.flagship.roster_ledger.audit.MoveOperation;
import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.league.LeagueSettings;
import com.flagship.roster_ledger.move.event.RosterEventRecorder;
import com.flagship.roster_ledger.observability.CorrelationContext;
import com.flagship.roster_ledger.observability.RosterMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for direct roster moves (free-agent adds, drops, add/drop swaps).
 *
 * Each move runs in one transaction: the release, the acquire, their log
 * entries, the cache updates and the outbox events commit together or not
 * at all. Every rejection is written to the failure sink after the rollback
 * and returned as a {@link MoveResult}; this method does not throw for
 * business failures.
 */
@Service
@Slf4j
public class RosterMoveService {

    private final RosterMoveEngine moveEngine;
    private final RosterEventRecorder eventRecorder;
    private final LeagueDirectory leagueDirectory;
    private final FailureSink failureSink;
    private final RosterMetrics rosterMetrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RosterMoveService(RosterMoveEngine moveEngine,
                             RosterEventRecorder eventRecorder,
                             LeagueDirectory leagueDirectory,
                             FailureSink failureSink,
                             RosterMetrics rosterMetrics,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.moveEngine = moveEngine;
        this.eventRecorder = eventRecorder;
        this.leagueDirectory = leagueDirectory;
        this.failureSink = failureSink;
        this.rosterMetrics = rosterMetrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public MoveResult executeMove(MoveRequest request) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putLeague(request.getLeagueId());

        String releasePlayerId = request.normalizedReleasePlayerId();
        String acquirePlayerId = request.normalizedAcquirePlayerId();
        MoveOperation operation = MoveOperation.of(releasePlayerId, acquirePlayerId);

        UUID teamId = null;
        try {
            Optional<UUID> team = request.getLeagueId() == null || request.getUserId() == null
                    ? Optional.empty()
                    : leagueDirectory.findTeamForUser(request.getLeagueId(), request.getUserId());
            if (team.isEmpty()) {
                return reject(request, null, operation, MoveStatus.NO_TEAM, FailureCategory.NO_TEAM,
                        "User does not have a team in this league", null, startTime);
            }
            teamId = team.get();
            CorrelationContext.putTeam(teamId);

            Optional<String> invalid = request.validate();
            if (invalid.isPresent()) {
                return reject(request, teamId, operation, MoveStatus.ERROR, FailureCategory.VALIDATION,
                        invalid.get(), null, startTime);
            }

            LeagueSettings settings = leagueDirectory.getSettings(request.getLeagueId());
            MoveCommand command = MoveCommand.builder()
                    .leagueId(request.getLeagueId())
                    .teamId(teamId)
                    .userId(request.getUserId())
                    .releasePlayerId(releasePlayerId)
                    .acquirePlayerId(acquirePlayerId)
                    .source(request.getSource())
                    .maxRosterSize(settings.maxRosterSize())
                    .enforceCooldown(true)
                    .build();

            AppliedMove applied = transactionTemplate.execute(status -> {
                AppliedMove move = moveEngine.apply(command);
                eventRecorder.record(move);
                return move;
            });

            long duration = System.currentTimeMillis() - startTime;
            rosterMetrics.recordMove(MoveStatus.SUCCESS.code(), request.getSource(), Duration.ofMillis(duration));
            log.info("Roster move completed: op={}, dropped={}, added={}, duration={}ms",
                    operation, releasePlayerId, acquirePlayerId, duration);

            return MoveResult.builder()
                    .status(MoveStatus.SUCCESS)
                    .reason("Roster move completed successfully")
                    .leagueId(applied.getLeagueId())
                    .teamId(applied.getTeamId())
                    .releasedPlayerId(applied.getReleasedPlayerId())
                    .acquiredPlayerId(applied.getAcquiredPlayerId())
                    .durationMs(duration)
                    .build();

        } catch (RosterMoveException e) {
            return reject(request, teamId, operation, e.getStatus(), e.getStatus().failureCategory(),
                    e.getMessage(), null, startTime);
        } catch (RuntimeException e) {
            // storage and other unexpected failures, including the team and settings lookups
            log.error("Roster move failed unexpectedly: op={}, dropped={}, added={}",
                    operation, releasePlayerId, acquirePlayerId, e);
            return reject(request, teamId, operation, MoveStatus.ERROR, FailureCategory.UNEXPECTED,
                    "Unexpected error: " + e.getMessage(), describe(e), startTime);
        } finally {
            CorrelationContext.clearRosterKeys();
        }
    }

    private MoveResult reject(MoveRequest request, UUID teamId, MoveOperation operation, MoveStatus status,
                              FailureCategory category, String reason, String detail, long startTime) {
        String playerId = request.normalizedAcquirePlayerId() != null
                ? request.normalizedAcquirePlayerId()
                : request.normalizedReleasePlayerId();

        failureSink.record(FailedAttempt.builder()
                .leagueId(request.getLeagueId())
                .teamId(teamId)
                .userId(request.getUserId())
                .operation(operation)
                .playerId(playerId)
                .category(category)
                .message(reason)
                .errorDetail(detail)
                .attemptedAt(clock.instant())
                .build());

        long duration = System.currentTimeMillis() - startTime;
        rosterMetrics.recordMove(status.code(), request.getSource(), Duration.ofMillis(duration));
        log.warn("Roster move rejected: status={}, reason={}", status.code(), reason);

        return MoveResult.builder()
                .status(status)
                .reason(reason)
                .failureCategory(category)
                .leagueId(request.getLeagueId())
                .teamId(teamId)
                .releasedPlayerId(request.normalizedReleasePlayerId())
                .acquiredPlayerId(request.normalizedAcquirePlayerId())
                .durationMs(duration)
                .build();
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getName() + ": " + root.getMessage();
    }
}
