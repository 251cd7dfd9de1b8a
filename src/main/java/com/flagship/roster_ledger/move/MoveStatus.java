package com.flagship.roster_ledger.move;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.roster_ledger.audit.FailureCategory;

/**
 * Outcome of a roster move. Serialized with the lower-case codes clients
 * already switch on.
 */
public enum MoveStatus {

    SUCCESS("success", null),

    /** The acquired player already belongs to a team in the league. */
    DUPLICATE_PLAYER("duplicate_player", FailureCategory.DUPLICATE_PLAYER),

    /** Acquiring would take the team past the league's roster cap. */
    ROSTER_FULL("roster_full", FailureCategory.ROSTER_FULL),

    /** The released player is not on the team. */
    NOT_OWNED("not_owned", FailureCategory.NOT_OWNED),

    /** The user has no team in the league. */
    NO_TEAM("no_team", FailureCategory.NO_TEAM),

    /** The player is inside a waiver window and can only be claimed. */
    ON_COOLDOWN("on_cooldown", FailureCategory.ON_COOLDOWN),

    /** Malformed request or unexpected failure; see the reason. */
    ERROR("error", FailureCategory.UNEXPECTED);

    private final String code;
    private final FailureCategory failureCategory;

    MoveStatus(String code, FailureCategory failureCategory) {
        this.code = code;
        this.failureCategory = failureCategory;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public FailureCategory failureCategory() {
        return failureCategory;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
