package com.flagship.roster_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used by roster operations.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header or is
 * generated per request. League, team and claim ids are put in the MDC while
 * a move or claim is processed so every log line of that unit carries them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LEAGUE_ID_MDC_KEY = "leagueId";
    public static final String TEAM_ID_MDC_KEY = "teamId";
    public static final String CLAIM_ID_MDC_KEY = "claimId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generated on first use in threads that did not
     * come through the HTTP filter (scheduler, tests).
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void putLeague(UUID leagueId) {
        putIfPresent(LEAGUE_ID_MDC_KEY, leagueId);
    }

    public static void putTeam(UUID teamId) {
        putIfPresent(TEAM_ID_MDC_KEY, teamId);
    }

    public static void putClaim(UUID claimId) {
        putIfPresent(CLAIM_ID_MDC_KEY, claimId);
    }

    public static void clearRosterKeys() {
        MDC.remove(LEAGUE_ID_MDC_KEY);
        MDC.remove(TEAM_ID_MDC_KEY);
        MDC.remove(CLAIM_ID_MDC_KEY);
    }

    private static void putIfPresent(String key, UUID value) {
        if (value != null) {
            MDC.put(key, value.toString());
        } else {
            MDC.remove(key);
        }
    }
}
