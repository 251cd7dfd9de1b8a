package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.move.MoveResult;
import lombok.Value;

/**
 * What an add request turned into: a direct move, a waiver claim, or nothing.
 */
@Value
public class AddPlayerResult {

    public enum Action {
        ADDED,
        CLAIM_SUBMITTED,
        REJECTED
    }

    Action action;
    String message;
    /** Set when a direct move was attempted. */
    MoveResult moveResult;
    /** Set when a claim was filed. */
    Claim claim;

    public static AddPlayerResult moved(MoveResult result) {
        return new AddPlayerResult(result.isSuccess() ? Action.ADDED : Action.REJECTED,
                result.getReason(), result, null);
    }

    public static AddPlayerResult claimed(Claim claim, String message) {
        return new AddPlayerResult(Action.CLAIM_SUBMITTED, message, null, claim);
    }

    public static AddPlayerResult rejected(String message) {
        return new AddPlayerResult(Action.REJECTED, message, null, null);
    }
}
