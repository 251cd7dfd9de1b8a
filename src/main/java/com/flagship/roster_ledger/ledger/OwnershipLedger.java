package com.flagship.roster_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The ownership ledger: the single source of truth for which team holds a
 * player in a league.
 *
 * Exclusivity is enforced by the {@code unique_player_per_league} constraint
 * on {@code roster_assignments}, not by reading before writing. Two
 * transactions racing to acquire the same player both issue the INSERT; the
 * database lets exactly one commit and the other surfaces as
 * {@link OwnershipViolationException.Kind#ALREADY_OWNED}.
 *
 * Uses JDBC directly, like the rest of the ledger code, so every statement
 * that matters for correctness is visible here.
 */
@Service
@Slf4j
public class OwnershipLedger {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public OwnershipLedger(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Assigns a player to a team.
     *
     * A uniqueness violation leaves the surrounding PostgreSQL transaction
     * aborted; callers must roll back (or roll back to a savepoint) after
     * catching the exception.
     *
     * @throws OwnershipViolationException if the player already belongs to any team in the league
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(UUID leagueId, UUID teamId, String playerId) {
        try {
            jdbcTemplate.update(
                "INSERT INTO roster_assignments (league_id, team_id, player_id, acquired_at) VALUES (?, ?, ?, ?)",
                leagueId,
                teamId,
                playerId,
                Timestamp.from(clock.instant())
            );
        } catch (DuplicateKeyException e) {
            throw OwnershipViolationException.alreadyOwned(leagueId, playerId, e);
        }
        log.debug("Ledger acquire: team={} player={}", teamId, playerId);
    }

    /**
     * Removes a player from a team. Deletes only a row owned by {@code teamId}.
     *
     * @throws OwnershipViolationException if the team does not hold the player
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void release(UUID leagueId, UUID teamId, String playerId) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM roster_assignments WHERE league_id = ? AND team_id = ? AND player_id = ?",
            leagueId,
            teamId,
            playerId
        );
        if (deleted == 0) {
            throw OwnershipViolationException.notOwned(leagueId, teamId, playerId);
        }
        log.debug("Ledger release: team={} player={}", teamId, playerId);
    }

    public Optional<UUID> findOwner(UUID leagueId, String playerId) {
        List<UUID> owners = jdbcTemplate.query(
            "SELECT team_id FROM roster_assignments WHERE league_id = ? AND player_id = ?",
            (rs, rowNum) -> rs.getObject("team_id", UUID.class),
            leagueId,
            playerId
        );
        return owners.stream().findFirst();
    }

    public List<RosterAssignment> findRoster(UUID leagueId, UUID teamId) {
        return jdbcTemplate.query(
            "SELECT league_id, team_id, player_id, acquired_at FROM roster_assignments " +
            "WHERE league_id = ? AND team_id = ? ORDER BY acquired_at, player_id",
            assignmentRowMapper(),
            leagueId,
            teamId
        );
    }

    public int countRoster(UUID leagueId, UUID teamId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM roster_assignments WHERE league_id = ? AND team_id = ?",
            Integer.class,
            leagueId,
            teamId
        );
        return count != null ? count : 0;
    }

    /**
     * Try-lock-and-skip ownership check used while resolving claims.
     *
     * Locks the player's ledger row with {@code FOR UPDATE SKIP LOCKED}. An
     * empty result is ambiguous (no row, or a row locked by someone else), so
     * a plain read settles which one it was. The probe never blocks.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OwnershipProbe probeOwnership(UUID leagueId, String playerId) {
        List<UUID> locked = jdbcTemplate.query(
            "SELECT team_id FROM roster_assignments WHERE league_id = ? AND player_id = ? FOR UPDATE SKIP LOCKED",
            (rs, rowNum) -> rs.getObject("team_id", UUID.class),
            leagueId,
            playerId
        );
        if (!locked.isEmpty()) {
            return OwnershipProbe.OWNED;
        }
        return findOwner(leagueId, playerId).isPresent() ? OwnershipProbe.CONTENDED : OwnershipProbe.FREE;
    }

    private RowMapper<RosterAssignment> assignmentRowMapper() {
        return (rs, rowNum) -> new RosterAssignment(
            rs.getObject("league_id", UUID.class),
            rs.getObject("team_id", UUID.class),
            rs.getString("player_id"),
            rs.getTimestamp("acquired_at").toInstant()
        );
    }
}
