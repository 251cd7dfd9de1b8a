package com.flagship.roster_ledger.audit;

/**
 * Shape of an attempted roster mutation, as recorded with a failure.
 */
public enum MoveOperation {
    ADD,
    DROP,
    ADD_DROP;

    public static MoveOperation of(String releasePlayerId, String acquirePlayerId) {
        if (releasePlayerId != null && acquirePlayerId != null) {
            return ADD_DROP;
        }
        return releasePlayerId != null ? DROP : ADD;
    }
}
