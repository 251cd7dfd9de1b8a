package com.flagship.roster_ledger.expiry;

import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.league.LeagueSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks the waiver period that follows a release.
 *
 * While a window is open only the claim processor may acquire the player.
 * Expired windows are closed lazily the first time they are consulted, and in
 * bulk by {@link #sweepExpired()} after each scheduled waiver run.
 */
@Service
@Slf4j
public class ExpiryTracker {

    private final JdbcTemplate jdbcTemplate;
    private final LeagueDirectory leagueDirectory;
    private final Clock clock;

    public ExpiryTracker(JdbcTemplate jdbcTemplate, LeagueDirectory leagueDirectory, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.leagueDirectory = leagueDirectory;
        this.clock = clock;
    }

    /**
     * Whether the player is still inside a waiver window.
     *
     * Closes the most recent window as a side effect when its cooldown has
     * elapsed.
     */
    @Transactional
    public boolean isOnCooldown(UUID leagueId, String playerId) {
        Optional<ExpiryWindow> latest = findLatestWindow(leagueId, playerId);
        if (latest.isEmpty() || !latest.get().isOpen()) {
            return false;
        }

        ExpiryWindow window = latest.get();
        Duration cooldown = leagueDirectory.getSettings(leagueId).getCooldown();
        Instant now = clock.instant();
        if (window.hasElapsed(cooldown, now)) {
            closeWindow(window.getId(), now);
            log.debug("Waiver window for player {} elapsed at {}, closed", playerId, window.clearsAt(cooldown));
            return false;
        }
        return true;
    }

    /**
     * When the player's open window clears, if there is one.
     */
    public Optional<Instant> getClearTime(UUID leagueId, String playerId) {
        Duration cooldown = leagueDirectory.getSettings(leagueId).getCooldown();
        return findLatestWindow(leagueId, playerId)
                .filter(ExpiryWindow::isOpen)
                .map(window -> window.clearsAt(cooldown));
    }

    /**
     * Opens a window for a just-released player, closing any window still open.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void openWindow(UUID leagueId, String playerId, UUID releasedByTeamId) {
        Instant now = clock.instant();
        closeOpenWindow(leagueId, playerId);
        jdbcTemplate.update(
            "INSERT INTO player_waiver_status (league_id, player_id, dropped_at, dropped_by_team_id) " +
            "VALUES (?, ?, ?, ?)",
            leagueId,
            playerId,
            Timestamp.from(now),
            releasedByTeamId
        );
    }

    /**
     * Closes the open window for a player, if any.
     *
     * @return true if a window was closed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean closeOpenWindow(UUID leagueId, String playerId) {
        int closed = jdbcTemplate.update(
            "UPDATE player_waiver_status SET cleared_at = ? " +
            "WHERE league_id = ? AND player_id = ? AND cleared_at IS NULL",
            Timestamp.from(clock.instant()),
            leagueId,
            playerId
        );
        return closed > 0;
    }

    /**
     * Closes every open window whose league cooldown has elapsed.
     *
     * @return number of windows closed
     */
    @Transactional
    public int sweepExpired() {
        Timestamp now = Timestamp.from(clock.instant());
        int closed = jdbcTemplate.update(
            "UPDATE player_waiver_status pws SET cleared_at = ? " +
            "FROM leagues l " +
            "WHERE pws.league_id = l.id AND pws.cleared_at IS NULL " +
            "AND pws.dropped_at + make_interval(hours => l.waiver_period_hours) <= ?",
            now,
            now
        );
        if (closed > 0) {
            log.info("Closed {} expired waiver windows", closed);
        }
        return closed;
    }

    public List<ExpiryWindow> findOpenWindows(UUID leagueId) {
        return jdbcTemplate.query(
            "SELECT id, league_id, player_id, dropped_at, cleared_at, dropped_by_team_id " +
            "FROM player_waiver_status WHERE league_id = ? AND cleared_at IS NULL ORDER BY dropped_at",
            windowRowMapper(),
            leagueId
        );
    }

    private Optional<ExpiryWindow> findLatestWindow(UUID leagueId, String playerId) {
        return jdbcTemplate.query(
            "SELECT id, league_id, player_id, dropped_at, cleared_at, dropped_by_team_id " +
            "FROM player_waiver_status WHERE league_id = ? AND player_id = ? " +
            "ORDER BY dropped_at DESC LIMIT 1",
            windowRowMapper(),
            leagueId,
            playerId
        ).stream().findFirst();
    }

    private void closeWindow(UUID windowId, Instant now) {
        jdbcTemplate.update(
            "UPDATE player_waiver_status SET cleared_at = ? WHERE id = ? AND cleared_at IS NULL",
            Timestamp.from(now),
            windowId
        );
    }

    private RowMapper<ExpiryWindow> windowRowMapper() {
        return (rs, rowNum) -> {
            Timestamp cleared = rs.getTimestamp("cleared_at");
            return new ExpiryWindow(
                rs.getObject("id", UUID.class),
                rs.getObject("league_id", UUID.class),
                rs.getString("player_id"),
                rs.getTimestamp("dropped_at").toInstant(),
                cleared != null ? cleared.toInstant() : null,
                rs.getObject("dropped_by_team_id", UUID.class)
            );
        };
    }
}
