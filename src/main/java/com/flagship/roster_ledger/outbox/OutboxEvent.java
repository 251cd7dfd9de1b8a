package com.flagship.roster_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A roster event waiting in, or already published from, the outbox.
 *
 * Every event of a league is keyed by the league id, so it goes to the same
 * Kafka partition and consumers see a league's roster changes in commit order.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID leagueId;
    String source;             // "RosterMove" or "WaiverClaim"
    String eventType;          // e.g. "PlayerAdded"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(UUID leagueId, String source, String eventType,
                                     String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            leagueId,
            source,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public String partitionKey() {
        return leagueId.toString();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
