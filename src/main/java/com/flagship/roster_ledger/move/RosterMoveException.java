package com.flagship.roster_ledger.move;

import lombok.Getter;

/**
 * Rejection raised inside a move transaction. Unchecked so the surrounding
 * transaction rolls back; converted to a {@link MoveResult} at the service
 * boundary.
 */
@Getter
public class RosterMoveException extends RuntimeException {

    private final MoveStatus status;

    public RosterMoveException(MoveStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RosterMoveException(MoveStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
