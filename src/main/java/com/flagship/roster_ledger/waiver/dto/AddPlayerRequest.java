package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class AddPlayerRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotBlank(message = "Player ID is required")
    @Size(max = 64, message = "Player ID must be at most 64 characters")
    @JsonProperty("player_id")
    String playerId;

    @Size(max = 64, message = "Player ID must be at most 64 characters")
    @JsonProperty("drop_player_id")
    String dropPlayerId;
}
