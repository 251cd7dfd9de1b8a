package com.flagship.roster_ledger.move;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * A user's request to release and/or acquire one player.
 */
@Value
@Builder
public class MoveRequest {

    public static final String SOURCE_FREE_AGENTS = "Free Agents";

    UUID leagueId;
    UUID userId;
    String releasePlayerId;
    String acquirePlayerId;
    @Builder.Default
    String source = SOURCE_FREE_AGENTS;

    /**
     * Checks the shape of the request. Ownership and capacity are checked
     * later, inside the move transaction.
     *
     * @return a reason if the request is malformed
     */
    public Optional<String> validate() {
        if (leagueId == null || userId == null) {
            return Optional.of("League and user are required");
        }
        if (isBlank(releasePlayerId) && isBlank(acquirePlayerId)) {
            return Optional.of("Must specify at least one player to add or drop");
        }
        String release = normalizedReleasePlayerId();
        if (release != null && release.equals(normalizedAcquirePlayerId())) {
            return Optional.of("Cannot add and drop the same player");
        }
        return Optional.empty();
    }

    public String normalizedReleasePlayerId() {
        return isBlank(releasePlayerId) ? null : releasePlayerId.trim();
    }

    public String normalizedAcquirePlayerId() {
        return isBlank(acquirePlayerId) ? null : acquirePlayerId.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
