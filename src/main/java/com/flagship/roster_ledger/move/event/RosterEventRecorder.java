package com.flagship.roster_ledger.move.event;

import com.flagship.roster_ledger.move.AppliedMove;
import com.flagship.roster_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes the outbox events of an applied move in the move's transaction.
 * The drop is written before the add, matching the order the engine applied them.
 */
@Component
@RequiredArgsConstructor
public class RosterEventRecorder {

    public static final String EVENT_SOURCE = "RosterMove";

    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AppliedMove move) {
        if (move.released()) {
            outboxService.saveEvent(EVENT_SOURCE, move.getLeagueId(),
                    PlayerDroppedEvent.EVENT_TYPE, PlayerDroppedEvent.from(move));
        }
        if (move.acquired()) {
            outboxService.saveEvent(EVENT_SOURCE, move.getLeagueId(),
                    PlayerAddedEvent.EVENT_TYPE, PlayerAddedEvent.from(move));
        }
    }
}
