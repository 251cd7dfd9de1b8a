package com.flagship.roster_ledger.league;

import com.flagship.roster_ledger.config.WaiverProperties;
import com.flagship.roster_ledger.waiver.WaiverPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookups against the league and team tables.
 *
 * Leagues and teams are created and edited elsewhere; this service only
 * reads them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeagueDirectory {

    private final JdbcTemplate jdbcTemplate;
    private final WaiverProperties waiverProperties;

    public Optional<LeagueSettings> findSettings(UUID leagueId) {
        List<LeagueSettings> settings = jdbcTemplate.query(
            "SELECT id, roster_size, ir_slots, waiver_type, waiver_period_hours, waiver_process_time " +
            "FROM leagues WHERE id = ?",
            (rs, rowNum) -> new LeagueSettings(
                rs.getObject("id", UUID.class),
                rs.getInt("roster_size"),
                rs.getInt("ir_slots"),
                WaiverPolicy.fromCode(rs.getString("waiver_type")),
                Duration.ofHours(rs.getInt("waiver_period_hours")),
                rs.getTime("waiver_process_time").toLocalTime()
            ),
            leagueId
        );
        return settings.stream().findFirst();
    }

    /**
     * Settings for a league, falling back to the defaults when the league row
     * is missing.
     */
    public LeagueSettings getSettings(UUID leagueId) {
        return findSettings(leagueId).orElseGet(() -> {
            log.warn("No settings found for league {}, using defaults", leagueId);
            return LeagueSettings.defaults(leagueId,
                    Duration.ofHours(waiverProperties.getDefaultCooldownHours()));
        });
    }

    public Optional<UUID> findTeamForUser(UUID leagueId, UUID userId) {
        List<UUID> teams = jdbcTemplate.query(
            "SELECT id FROM teams WHERE league_id = ? AND owner_id = ?",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            leagueId,
            userId
        );
        return teams.stream().findFirst();
    }

    public Optional<UUID> findTeamOwner(UUID teamId) {
        List<UUID> owners = jdbcTemplate.query(
            "SELECT owner_id FROM teams WHERE id = ? AND owner_id IS NOT NULL",
            (rs, rowNum) -> rs.getObject("owner_id", UUID.class),
            teamId
        );
        return owners.stream().findFirst();
    }

    public boolean teamBelongsToLeague(UUID leagueId, UUID teamId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM teams WHERE id = ? AND league_id = ?",
            Integer.class,
            teamId,
            leagueId
        );
        return count != null && count > 0;
    }

    /**
     * Leagues that currently have at least one pending claim.
     */
    public List<LeagueSettings> findLeaguesWithPendingClaims() {
        List<UUID> leagueIds = jdbcTemplate.queryForList(
            "SELECT DISTINCT league_id FROM waiver_claims WHERE status = 'PENDING' ORDER BY league_id",
            UUID.class
        );
        return leagueIds.stream()
                .map(this::getSettings)
                .toList();
    }
}
