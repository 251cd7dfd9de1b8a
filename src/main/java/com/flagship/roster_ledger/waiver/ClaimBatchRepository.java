package com.flagship.roster_ledger.waiver;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * SQL used by waiver runs: the per-league advisory lock, the pending-claim
 * selection and the conditional status writes.
 */
@Repository
public class ClaimBatchRepository {

    static final String LOCK_KEY_PREFIX = "waivers:";

    private final JdbcTemplate jdbcTemplate;

    public ClaimBatchRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Takes the league's run lock for the rest of the current transaction
     * without waiting.
     *
     * @return false if another run holds it
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean tryLockLeague(UUID leagueId) {
        Boolean locked = jdbcTemplate.queryForObject(
            "SELECT pg_try_advisory_xact_lock(hashtext(?))",
            Boolean.class,
            LOCK_KEY_PREFIX + leagueId
        );
        return Boolean.TRUE.equals(locked);
    }

    /**
     * Pending claims of a league with the claiming team's live rank. A team
     * without a rank row falls back to the rank it had when it filed.
     * Unordered; the league policy sorts them.
     */
    public List<PendingClaim> findPending(UUID leagueId) {
        return jdbcTemplate.query(
            "SELECT wc.id, wc.league_id, wc.team_id, wc.player_id, wc.drop_player_id, " +
            "COALESCE(wp.priority, wc.priority) AS team_rank, wc.created_at " +
            "FROM waiver_claims wc " +
            "LEFT JOIN waiver_priority wp ON wp.league_id = wc.league_id AND wp.team_id = wc.team_id " +
            "WHERE wc.league_id = ? AND wc.status = 'PENDING'",
            (rs, rowNum) -> new PendingClaim(
                rs.getObject("id", UUID.class),
                rs.getObject("league_id", UUID.class),
                rs.getObject("team_id", UUID.class),
                rs.getString("player_id"),
                rs.getString("drop_player_id"),
                rs.getInt("team_rank"),
                rs.getTimestamp("created_at").toInstant()
            ),
            leagueId
        );
    }

    /**
     * Locks a claim row until the end of the current transaction. Blocks a
     * concurrent cancel until the claim is resolved.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Claim> lockClaim(UUID claimId) {
        List<Claim> claims = jdbcTemplate.query(
            "SELECT id, league_id, team_id, player_id, drop_player_id, priority, status, failure_reason, " +
            "created_at, updated_at, processed_at FROM waiver_claims WHERE id = ? FOR UPDATE",
            claimRowMapper(),
            claimId
        );
        return claims.stream().findFirst();
    }

    /**
     * Writes a resolved claim. Only a row that is still pending is changed.
     *
     * @return true if the row was updated
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean saveResolution(Claim resolved) {
        if (!resolved.isTerminal()) {
            throw new IllegalArgumentException("Claim " + resolved.getId() + " is not resolved");
        }
        int updated = jdbcTemplate.update(
            "UPDATE waiver_claims SET status = ?, failure_reason = ?, updated_at = ?, processed_at = ? " +
            "WHERE id = ? AND status = 'PENDING'",
            resolved.getStatus().name(),
            resolved.getFailureReason(),
            Timestamp.from(resolved.getUpdatedAt()),
            resolved.getProcessedAt() != null ? Timestamp.from(resolved.getProcessedAt()) : null,
            resolved.getId()
        );
        return updated == 1;
    }

    public Optional<Instant> findLastProcessedAt(UUID leagueId) {
        Timestamp last = jdbcTemplate.queryForObject(
            "SELECT MAX(processed_at) FROM waiver_claims WHERE league_id = ?",
            Timestamp.class,
            leagueId
        );
        return Optional.ofNullable(last).map(Timestamp::toInstant);
    }

    /**
     * Pending claim count per league, for leagues that have any.
     */
    public Map<UUID, Long> countPendingByLeague() {
        Map<UUID, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT league_id, COUNT(*) AS pending FROM waiver_claims WHERE status = 'PENDING' " +
            "GROUP BY league_id ORDER BY league_id",
            rs -> {
                counts.put(rs.getObject("league_id", UUID.class), rs.getLong("pending"));
            }
        );
        return counts;
    }

    public long countPending() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM waiver_claims WHERE status = 'PENDING'", Long.class);
        return count != null ? count : 0L;
    }

    public Optional<Instant> findOldestPendingCreatedAt() {
        Timestamp oldest = jdbcTemplate.queryForObject(
            "SELECT MIN(created_at) FROM waiver_claims WHERE status = 'PENDING'", Timestamp.class);
        return Optional.ofNullable(oldest).map(Timestamp::toInstant);
    }

    private RowMapper<Claim> claimRowMapper() {
        return (rs, rowNum) -> {
            Timestamp processedAt = rs.getTimestamp("processed_at");
            return new Claim(
                rs.getObject("id", UUID.class),
                rs.getObject("league_id", UUID.class),
                rs.getObject("team_id", UUID.class),
                rs.getString("player_id"),
                rs.getString("drop_player_id"),
                rs.getInt("priority"),
                ClaimStatus.valueOf(rs.getString("status")),
                rs.getString("failure_reason"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                processedAt != null ? processedAt.toInstant() : null
            );
        };
    }
}
