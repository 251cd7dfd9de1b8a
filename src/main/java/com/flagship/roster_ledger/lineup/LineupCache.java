package com.flagship.roster_ledger.lineup;

import com.flagship.roster_ledger.common.jdbc.SavepointTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Keeps the {@code team_lineups} UI cache in step with the ledger.
 *
 * The cache is a projection: the ledger is authoritative and the cache is
 * updated in the same transaction, but inside a savepoint. A failed cache
 * write is rolled back to the savepoint and logged; it never fails the move.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LineupCache {

    private final JdbcTemplate jdbcTemplate;
    private final SavepointTemplate savepointTemplate;

    /**
     * Removes a player from starters, bench, IR and slot assignments.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void removePlayer(UUID leagueId, UUID teamId, String playerId) {
        bestEffort("lineup_remove", leagueId, teamId, playerId, () -> jdbcTemplate.update(
            "UPDATE team_lineups SET " +
            "starters = (SELECT COALESCE(jsonb_agg(elem), '[]'::jsonb) " +
            "  FROM jsonb_array_elements_text(starters) elem WHERE elem <> ?), " +
            "bench = (SELECT COALESCE(jsonb_agg(elem), '[]'::jsonb) " +
            "  FROM jsonb_array_elements_text(bench) elem WHERE elem <> ?), " +
            "ir = (SELECT COALESCE(jsonb_agg(elem), '[]'::jsonb) " +
            "  FROM jsonb_array_elements_text(ir) elem WHERE elem <> ?), " +
            "slot_assignments = slot_assignments - ?::text, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE league_id = ? AND team_id = ?",
            playerId, playerId, playerId, playerId, leagueId, teamId
        ));
    }

    /**
     * Appends a player to the bench, creating the lineup row if the team has none.
     * The owner arranges starters manually.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void addToBench(UUID leagueId, UUID teamId, String playerId) {
        bestEffort("lineup_add", leagueId, teamId, playerId, () -> {
            int updated = jdbcTemplate.update(
                "UPDATE team_lineups SET bench = bench || jsonb_build_array(?::text), " +
                "updated_at = CURRENT_TIMESTAMP " +
                "WHERE league_id = ? AND team_id = ? AND NOT bench @> jsonb_build_array(?::text)",
                playerId, leagueId, teamId, playerId
            );
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO team_lineups (league_id, team_id, bench) " +
                    "VALUES (?, ?, jsonb_build_array(?::text)) ON CONFLICT (league_id, team_id) DO NOTHING",
                    leagueId, teamId, playerId
                );
            }
            return updated;
        });
    }

    /**
     * Locks the team's lineup row until the end of the transaction. Blocks
     * while another transaction holds it. A team without a lineup row is not
     * locked.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean lockLineup(UUID leagueId, UUID teamId) {
        List<UUID> rows = jdbcTemplate.query(
            "SELECT team_id FROM team_lineups WHERE league_id = ? AND team_id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getObject("team_id", UUID.class),
            leagueId,
            teamId
        );
        return !rows.isEmpty();
    }

    /**
     * Player ids currently on the bench, in order.
     */
    public List<String> findBench(UUID leagueId, UUID teamId) {
        return jdbcTemplate.queryForList(
            "SELECT jsonb_array_elements_text(bench) FROM team_lineups WHERE league_id = ? AND team_id = ?",
            String.class,
            leagueId,
            teamId
        );
    }

    private void bestEffort(String savepoint, UUID leagueId, UUID teamId, String playerId,
                            Supplier<Integer> write) {
        try {
            savepointTemplate.execute(savepoint, write);
        } catch (DataAccessException e) {
            log.warn("Lineup cache update {} failed for team {} player {}, ledger change kept: {}",
                    savepoint, teamId, playerId, e.getMessage());
        }
    }
}
