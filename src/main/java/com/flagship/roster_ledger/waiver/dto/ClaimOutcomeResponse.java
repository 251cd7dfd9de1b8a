package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.waiver.ClaimOutcome;
import lombok.Value;

import java.util.Locale;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClaimOutcomeResponse {

    @JsonProperty("claim_id")
    UUID claimId;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("player_id")
    String playerId;

    /** "successful" or "failed". */
    @JsonProperty("status")
    String status;

    @JsonProperty("reason")
    String reason;

    public static ClaimOutcomeResponse from(ClaimOutcome outcome) {
        return new ClaimOutcomeResponse(
            outcome.getClaimId(),
            outcome.getTeamId(),
            outcome.getPlayerId(),
            outcome.getStatus().name().toLowerCase(Locale.ROOT),
            outcome.getReason()
        );
    }
}
