package com.flagship.roster_ledger.lineup;

import com.flagship.roster_ledger.common.jdbc.SavepointTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Legacy {@code draft_picks} mirror still read by older roster views.
 *
 * Post-draft adds are stored with round {@value #POST_DRAFT_ROUND}. Releases
 * soft-delete the row; a later re-acquire by the same team reactivates it.
 * Same best-effort rules as {@link LineupCache}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DraftPickMirror {

    static final int POST_DRAFT_ROUND = 999;

    private final JdbcTemplate jdbcTemplate;
    private final SavepointTemplate savepointTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordAdd(UUID leagueId, UUID teamId, String playerId) {
        bestEffort("draft_pick_add", teamId, playerId, () -> jdbcTemplate.update(
            "INSERT INTO draft_picks (league_id, team_id, player_id, round_number, pick_number, picked_at, deleted_at) " +
            "VALUES (?, ?, ?, ?, " +
            "(SELECT COALESCE(MAX(pick_number), 0) + 1 FROM draft_picks WHERE league_id = ?), " +
            "CURRENT_TIMESTAMP, NULL) " +
            "ON CONFLICT (league_id, team_id, player_id) " +
            "DO UPDATE SET deleted_at = NULL, picked_at = CURRENT_TIMESTAMP",
            leagueId, teamId, playerId, POST_DRAFT_ROUND, leagueId
        ));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordDrop(UUID leagueId, UUID teamId, String playerId) {
        bestEffort("draft_pick_drop", teamId, playerId, () -> jdbcTemplate.update(
            "UPDATE draft_picks SET deleted_at = CURRENT_TIMESTAMP " +
            "WHERE league_id = ? AND team_id = ? AND player_id = ? AND deleted_at IS NULL",
            leagueId, teamId, playerId
        ));
    }

    /**
     * Whether the team has an active (not soft-deleted) pick row for the player.
     */
    public boolean isActive(UUID leagueId, UUID teamId, String playerId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM draft_picks WHERE league_id = ? AND team_id = ? AND player_id = ? " +
            "AND deleted_at IS NULL",
            Integer.class,
            leagueId, teamId, playerId
        );
        return count != null && count > 0;
    }

    private void bestEffort(String savepoint, UUID teamId, String playerId,
                            Supplier<Integer> write) {
        try {
            savepointTemplate.execute(savepoint, write);
        } catch (DataAccessException e) {
            log.warn("Draft pick mirror update {} failed for team {} player {}: {}",
                    savepoint, teamId, playerId, e.getMessage());
        }
    }
}
