package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.move.MoveStatus;
import com.flagship.roster_ledger.waiver.AddPlayerResult;
import lombok.Value;

import java.util.Locale;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AddPlayerResponse {

    /** "added", "claim_submitted" or "rejected". */
    @JsonProperty("action")
    String action;

    @JsonProperty("message")
    String message;

    @JsonProperty("move_status")
    MoveStatus moveStatus;

    @JsonProperty("claim_id")
    UUID claimId;

    public static AddPlayerResponse from(AddPlayerResult result) {
        return new AddPlayerResponse(
            result.getAction().name().toLowerCase(Locale.ROOT),
            result.getMessage(),
            result.getMoveResult() != null ? result.getMoveResult().getStatus() : null,
            result.getClaim() != null ? result.getClaim().getId() : null
        );
    }
}
