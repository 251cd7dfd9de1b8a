package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.waiver.LeagueRunSummary;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class RunSummaryResponse {

    @JsonProperty("league_id")
    UUID leagueId;

    @JsonProperty("processed")
    int processed;

    @JsonProperty("successful")
    int successful;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("results")
    List<ClaimOutcomeResponse> results;

    public static RunSummaryResponse from(LeagueRunSummary summary) {
        return new RunSummaryResponse(
            summary.getLeagueId(),
            summary.getProcessed(),
            summary.getSuccessful(),
            summary.getFailed(),
            summary.getOutcomes().stream().map(ClaimOutcomeResponse::from).toList()
        );
    }
}
