package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.waiver.LeagueProcessingStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ProcessingStatusResponse {

    @JsonProperty("league_id")
    UUID leagueId;

    @JsonProperty("pending_claims")
    long pendingClaims;

    @JsonProperty("last_processed_at")
    Instant lastProcessedAt;

    @JsonProperty("next_processing_at")
    Instant nextProcessingAt;

    public static ProcessingStatusResponse from(LeagueProcessingStatus status) {
        return new ProcessingStatusResponse(status.getLeagueId(), status.getPendingClaims(),
                status.getLastProcessedAt(), status.getNextProcessingAt());
    }
}
