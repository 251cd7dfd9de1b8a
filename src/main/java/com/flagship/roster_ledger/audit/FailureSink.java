package com.flagship.roster_ledger.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Write-only sink for rejected mutations.
 *
 * Each record is written in its own transaction: the attempt being recorded
 * has usually just been rolled back, and the record has to survive that.
 * A failure to write the record is logged and does not change the outcome
 * reported to the caller.
 */
@Service
@Slf4j
public class FailureSink {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public FailureSink(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void record(FailedAttempt attempt) {
        try {
            requiresNew.executeWithoutResult(status -> insert(attempt));
            log.warn("Recorded failed {} for player {}: [{}] {}",
                    attempt.getOperation(), attempt.getPlayerId(), attempt.getCategory(), attempt.getMessage());
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not record failed {} for league {} player {} ({}): {}",
                    attempt.getOperation(), attempt.getLeagueId(), attempt.getPlayerId(),
                    attempt.getMessage(), e.getMessage(), e);
        }
    }

    /**
     * Most recent failures for a league, newest first.
     */
    public List<FailedAttempt> findRecent(UUID leagueId, int limit) {
        return jdbcTemplate.query(
            "SELECT league_id, team_id, user_id, operation_type, player_id, error_code, error_message, " +
            "error_detail, attempted_at FROM failed_transactions WHERE league_id = ? " +
            "ORDER BY attempted_at DESC LIMIT ?",
            (rs, rowNum) -> FailedAttempt.builder()
                .leagueId(rs.getObject("league_id", UUID.class))
                .teamId(rs.getObject("team_id", UUID.class))
                .userId(rs.getObject("user_id", UUID.class))
                .operation(MoveOperation.valueOf(rs.getString("operation_type")))
                .playerId(rs.getString("player_id"))
                .category(FailureCategory.valueOf(rs.getString("error_code")))
                .message(rs.getString("error_message"))
                .errorDetail(rs.getString("error_detail"))
                .attemptedAt(rs.getTimestamp("attempted_at").toInstant())
                .build(),
            leagueId,
            limit
        );
    }

    private void insert(FailedAttempt attempt) {
        jdbcTemplate.update(
            "INSERT INTO failed_transactions (league_id, team_id, user_id, operation_type, player_id, " +
            "error_code, error_message, error_detail, attempted_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            attempt.getLeagueId(),
            attempt.getTeamId(),
            attempt.getUserId(),
            attempt.getOperation().name(),
            attempt.getPlayerId(),
            attempt.getCategory().name(),
            attempt.getMessage(),
            attempt.getErrorDetail(),
            Timestamp.from(attempt.getAttemptedAt() != null ? attempt.getAttemptedAt() : clock.instant())
        );
    }
}
