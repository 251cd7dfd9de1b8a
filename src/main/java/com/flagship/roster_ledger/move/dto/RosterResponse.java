package com.flagship.roster_ledger.move.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.ledger.RosterAssignment;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class RosterResponse {

    @JsonProperty("league_id")
    UUID leagueId;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("size")
    int size;

    @JsonProperty("max_size")
    int maxSize;

    @JsonProperty("players")
    List<Player> players;

    public static RosterResponse from(UUID leagueId, UUID teamId, int maxSize, List<RosterAssignment> roster) {
        List<Player> players = roster.stream()
            .map(a -> new Player(a.getPlayerId(), a.getAcquiredAt()))
            .toList();
        return new RosterResponse(leagueId, teamId, players.size(), maxSize, players);
    }

    @Value
    public static class Player {
        @JsonProperty("player_id")
        String playerId;

        @JsonProperty("acquired_at")
        Instant acquiredAt;
    }
}
