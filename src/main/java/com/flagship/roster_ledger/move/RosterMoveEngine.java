package com.flagship.roster_ledger.move;

import com.flagship.roster_ledger.audit.TransactionLog;
import com.flagship.roster_ledger.audit.TransactionType;
import com.flagship.roster_ledger.expiry.ExpiryTracker;
import com.flagship.roster_ledger.ledger.OwnershipLedger;
import com.flagship.roster_ledger.ledger.OwnershipViolationException;
import com.flagship.roster_ledger.lineup.DraftPickMirror;
import com.flagship.roster_ledger.lineup.LineupCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies one release and/or acquire for a team inside the caller's
 * transaction. The only code that writes the ownership ledger.
 *
 * The release runs first so a team at the cap can swap a player. Any
 * rejection is raised as {@link RosterMoveException}; the caller must roll
 * back the transaction (or savepoint) it opened, which also undoes a release
 * that already happened.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RosterMoveEngine {

    static final String DUPLICATE_PLAYER_MESSAGE = "Player is already on a team in this league";

    private final OwnershipLedger ownershipLedger;
    private final TransactionLog transactionLog;
    private final ExpiryTracker expiryTracker;
    private final LineupCache lineupCache;
    private final DraftPickMirror draftPickMirror;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public AppliedMove apply(MoveCommand command) {
        if (command.getReleasePlayerId() != null) {
            release(command);
        }
        if (command.getAcquirePlayerId() != null) {
            acquire(command);
        }

        return new AppliedMove(
            command.getLeagueId(),
            command.getTeamId(),
            command.getUserId(),
            command.getReleasePlayerId(),
            command.getAcquirePlayerId(),
            command.getSource(),
            clock.instant()
        );
    }

    private void release(MoveCommand command) {
        String playerId = command.getReleasePlayerId();
        try {
            ownershipLedger.release(command.getLeagueId(), command.getTeamId(), playerId);
        } catch (OwnershipViolationException e) {
            throw new RosterMoveException(MoveStatus.NOT_OWNED,
                    String.format("Player %s is not on your roster", playerId), e);
        }

        transactionLog.append(command.getLeagueId(), command.getTeamId(), command.getUserId(),
                TransactionType.DROP, playerId, command.getSource());
        expiryTracker.openWindow(command.getLeagueId(), playerId, command.getTeamId());
        lineupCache.removePlayer(command.getLeagueId(), command.getTeamId(), playerId);
        draftPickMirror.recordDrop(command.getLeagueId(), command.getTeamId(), playerId);
    }

    private void acquire(MoveCommand command) {
        String playerId = command.getAcquirePlayerId();

        if (command.isEnforceCooldown() && expiryTracker.isOnCooldown(command.getLeagueId(), playerId)) {
            String clearsAt = expiryTracker.getClearTime(command.getLeagueId(), playerId)
                    .map(Instant::toString)
                    .orElse("the end of the waiver period");
            throw new RosterMoveException(MoveStatus.ON_COOLDOWN,
                    String.format("Player %s is on waivers until %s. Submit a waiver claim instead.",
                            playerId, clearsAt));
        }

        int rosterSize = ownershipLedger.countRoster(command.getLeagueId(), command.getTeamId());
        if (rosterSize >= command.getMaxRosterSize()) {
            throw new RosterMoveException(MoveStatus.ROSTER_FULL,
                    String.format("Roster is full (%d / %d players). Drop a player first.",
                            rosterSize, command.getMaxRosterSize()));
        }

        try {
            ownershipLedger.acquire(command.getLeagueId(), command.getTeamId(), playerId);
        } catch (OwnershipViolationException e) {
            throw new RosterMoveException(MoveStatus.DUPLICATE_PLAYER, DUPLICATE_PLAYER_MESSAGE, e);
        }

        transactionLog.append(command.getLeagueId(), command.getTeamId(), command.getUserId(),
                TransactionType.ADD, playerId, command.getSource());
        lineupCache.addToBench(command.getLeagueId(), command.getTeamId(), playerId);
        draftPickMirror.recordAdd(command.getLeagueId(), command.getTeamId(), playerId);
    }
}
