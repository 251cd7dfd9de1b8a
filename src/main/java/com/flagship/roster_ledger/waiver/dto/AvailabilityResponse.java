package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.waiver.PlayerAvailability;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AvailabilityResponse {

    @JsonProperty("player_id")
    String playerId;

    @JsonProperty("available")
    boolean available;

    @JsonProperty("rostered")
    boolean rostered;

    @JsonProperty("owner_team_id")
    UUID ownerTeamId;

    @JsonProperty("on_waivers")
    boolean onWaivers;

    @JsonProperty("waivers_clear_at")
    Instant waiversClearAt;

    @JsonProperty("lock_reason")
    String lockReason;

    public static AvailabilityResponse from(PlayerAvailability availability) {
        return new AvailabilityResponse(
            availability.getPlayerId(),
            availability.isAvailable(),
            availability.isRostered(),
            availability.getOwnerTeamId(),
            availability.isOnWaivers(),
            availability.getWaiversClearAt(),
            availability.getLockReason()
        );
    }
}
