package com.flagship.roster_ledger.priority;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-league waiver priority ranks.
 *
 * Ranks are unique within a league. The constraint is deferred to commit time
 * so a rotation can shift every rank in a single statement.
 */
@Service
@Slf4j
public class PriorityRotationTable {

    private final JdbcTemplate jdbcTemplate;

    public PriorityRotationTable(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Ranks of a league, best first.
     */
    public List<PriorityRank> findOrder(UUID leagueId) {
        return jdbcTemplate.query(
            "SELECT league_id, team_id, priority, updated_at FROM waiver_priority " +
            "WHERE league_id = ? ORDER BY priority",
            rankRowMapper(),
            leagueId
        );
    }

    public Optional<PriorityRank> findRank(UUID leagueId, UUID teamId) {
        return jdbcTemplate.query(
            "SELECT league_id, team_id, priority, updated_at FROM waiver_priority " +
            "WHERE league_id = ? AND team_id = ?",
            rankRowMapper(),
            leagueId,
            teamId
        ).stream().findFirst();
    }

    /**
     * Moves a team to the worst rank. Every team ranked behind it moves up by
     * one; teams ahead of it keep their rank.
     *
     * @return false if the team has no rank in the league
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean moveToBack(UUID leagueId, UUID teamId) {
        int updated = jdbcTemplate.update(
            "WITH target AS (" +
            "  SELECT priority AS current_rank, " +
            "    (SELECT MAX(priority) FROM waiver_priority WHERE league_id = ?) AS last_rank " +
            "  FROM waiver_priority WHERE league_id = ? AND team_id = ?" +
            ") " +
            "UPDATE waiver_priority wp SET " +
            "  priority = CASE WHEN wp.team_id = ? THEN target.last_rank ELSE wp.priority - 1 END, " +
            "  updated_at = CURRENT_TIMESTAMP " +
            "FROM target " +
            "WHERE wp.league_id = ? AND (wp.team_id = ? OR wp.priority > target.current_rank)",
            leagueId, leagueId, teamId, teamId, leagueId, teamId
        );
        if (updated == 0) {
            log.warn("Team {} has no waiver priority in league {}, rotation skipped", teamId, leagueId);
            return false;
        }
        log.debug("Rotated team {} to the back of league {} ({} ranks updated)", teamId, leagueId, updated);
        return true;
    }

    /**
     * Rewrites the league's ranks as 1..n in the given team order. Used when
     * standings are recomputed or a league is set up.
     */
    @Transactional
    public void resetOrder(UUID leagueId, List<UUID> teamIdsInOrder) {
        jdbcTemplate.update("DELETE FROM waiver_priority WHERE league_id = ?", leagueId);
        int rank = 1;
        for (UUID teamId : teamIdsInOrder) {
            jdbcTemplate.update(
                "INSERT INTO waiver_priority (league_id, team_id, priority, updated_at) " +
                "VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
                leagueId, teamId, rank++
            );
        }
        log.info("Reset waiver priority for league {}: {} teams", leagueId, teamIdsInOrder.size());
    }

    private RowMapper<PriorityRank> rankRowMapper() {
        return (rs, rowNum) -> new PriorityRank(
            rs.getObject("league_id", UUID.class),
            rs.getObject("team_id", UUID.class),
            rs.getInt("priority"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
