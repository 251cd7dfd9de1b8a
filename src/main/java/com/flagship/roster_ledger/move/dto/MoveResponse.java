package com.flagship.roster_ledger.move.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.move.MoveResult;
import com.flagship.roster_ledger.move.MoveStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class MoveResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("status")
    MoveStatus status;

    @JsonProperty("message")
    String message;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("dropped_player_id")
    String droppedPlayerId;

    @JsonProperty("added_player_id")
    String addedPlayerId;

    @JsonProperty("duration_ms")
    long durationMs;

    public static MoveResponse from(MoveResult result) {
        return MoveResponse.builder()
            .success(result.isSuccess())
            .status(result.getStatus())
            .message(result.getReason())
            .teamId(result.getTeamId())
            .droppedPlayerId(result.getReleasedPlayerId())
            .addedPlayerId(result.getAcquiredPlayerId())
            .durationMs(result.getDurationMs())
            .build();
    }
}
