package com.flagship.roster_ledger.move.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.roster_ledger.audit.TransactionLedgerEntry;
import com.flagship.roster_ledger.audit.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a league's transaction feed.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("team_id")
    UUID teamId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("player_id")
    String playerId;

    @JsonProperty("source")
    String source;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(TransactionLedgerEntry entry) {
        return TransactionResponse.builder()
            .id(entry.getId())
            .teamId(entry.getTeamId())
            .userId(entry.getUserId())
            .type(entry.getType())
            .playerId(entry.getPlayerId())
            .source(entry.getSource())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
