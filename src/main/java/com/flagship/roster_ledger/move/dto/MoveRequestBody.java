package com.flagship.roster_ledger.move.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Body of a direct roster move. At least one player id must be given; the
 * service checks that, not bean validation.
 */
@Value
public class MoveRequestBody {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @Size(max = 64, message = "Player ID must be at most 64 characters")
    @JsonProperty("drop_player_id")
    String dropPlayerId;

    @Size(max = 64, message = "Player ID must be at most 64 characters")
    @JsonProperty("add_player_id")
    String addPlayerId;
}
