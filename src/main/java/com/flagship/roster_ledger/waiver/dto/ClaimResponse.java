package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.waiver.Claim;
import com.flagship.roster_ledger.waiver.ClaimStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ClaimResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("league_id")
    UUID leagueId;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("player_id")
    String playerId;

    @JsonProperty("drop_player_id")
    String dropPlayerId;

    @JsonProperty("priority")
    int priority;

    @JsonProperty("status")
    ClaimStatus status;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static ClaimResponse from(Claim claim) {
        return ClaimResponse.builder()
            .id(claim.getId())
            .leagueId(claim.getLeagueId())
            .teamId(claim.getTeamId())
            .playerId(claim.getPlayerId())
            .dropPlayerId(claim.getDropPlayerId())
            .priority(claim.getPriority())
            .status(claim.getStatus())
            .failureReason(claim.getFailureReason())
            .createdAt(claim.getCreatedAt())
            .processedAt(claim.getProcessedAt())
            .build();
    }
}
