package com.flagship.roster_ledger.audit;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of ownership changes.
 *
 * Entries are written in the same transaction as the ledger mutation they
 * describe, so a rolled back move leaves no trace here. The table rejects
 * UPDATE and DELETE with a trigger.
 */
@Service
public class TransactionLog {

    private final JdbcTemplate jdbcTemplate;

    public TransactionLog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends an entry within the caller's transaction.
     *
     * @param source channel the change came through, e.g. "Free Agents" or "Waiver Processing"
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(UUID leagueId, UUID teamId, UUID userId, TransactionType type,
                       String playerId, String source) {
        jdbcTemplate.update(
            "INSERT INTO transaction_ledger (league_id, team_id, user_id, type, player_id, source, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            leagueId,
            teamId,
            userId,
            type.name(),
            playerId,
            source
        );
    }

    /**
     * Most recent entries for a league, newest first.
     */
    public List<TransactionLedgerEntry> findRecent(UUID leagueId, int limit) {
        return jdbcTemplate.query(
            "SELECT id, league_id, team_id, user_id, type, player_id, source, created_at, sequence_number " +
            "FROM transaction_ledger WHERE league_id = ? ORDER BY sequence_number DESC LIMIT ?",
            entryRowMapper(),
            leagueId,
            limit
        );
    }

    /**
     * Full history of one player in a league, oldest first.
     */
    public List<TransactionLedgerEntry> findForPlayer(UUID leagueId, String playerId) {
        return jdbcTemplate.query(
            "SELECT id, league_id, team_id, user_id, type, player_id, source, created_at, sequence_number " +
            "FROM transaction_ledger WHERE league_id = ? AND player_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            leagueId,
            playerId
        );
    }

    private RowMapper<TransactionLedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new TransactionLedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("league_id")),
            UUID.fromString(rs.getString("team_id")),
            rs.getString("user_id") != null ? UUID.fromString(rs.getString("user_id")) : null,
            TransactionType.valueOf(rs.getString("type")),
            rs.getString("player_id"),
            rs.getString("source"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
