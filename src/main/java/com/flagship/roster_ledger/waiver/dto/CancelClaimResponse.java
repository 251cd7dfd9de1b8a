package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.waiver.CancelResult;
import lombok.Value;

import java.util.UUID;

@Value
public class CancelClaimResponse {

    @JsonProperty("claim_id")
    UUID claimId;

    @JsonProperty("result")
    CancelResult result;
}
