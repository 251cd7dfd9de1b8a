package com.flagship.roster_ledger.waiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.priority.PriorityRank;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PriorityResponse {

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("priority")
    int priority;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PriorityResponse from(PriorityRank rank) {
        return new PriorityResponse(rank.getTeamId(), rank.getRank(), rank.getUpdatedAt());
    }
}
