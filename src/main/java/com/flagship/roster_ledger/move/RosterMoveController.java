package com.flagship.roster_ledger.move;

import com.flagship.roster_ledger.audit.FailureCategory;
import com.flagship.roster_ledger.audit.TransactionLog;
import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.ledger.OwnershipLedger;
import com.flagship.roster_ledger.move.dto.MoveRequestBody;
import com.flagship.roster_ledger.move.dto.MoveResponse;
import com.flagship.roster_ledger.move.dto.RosterResponse;
import com.flagship.roster_ledger.move.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Direct roster moves and roster reads.
 *
 * A move always answers with a {@link MoveResponse}; the HTTP status mirrors
 * the move status so clients can branch without parsing the body.
 */
@RestController
@RequestMapping("/api/leagues/{leagueId}")
@RequiredArgsConstructor
@Slf4j
public class RosterMoveController {

    private static final int MAX_TRANSACTION_LIMIT = 500;

    private final RosterMoveService moveService;
    private final OwnershipLedger ownershipLedger;
    private final LeagueDirectory leagueDirectory;
    private final TransactionLog transactionLog;

    @PostMapping("/moves")
    public ResponseEntity<MoveResponse> executeMove(@PathVariable("leagueId") UUID leagueId,
                                                    @Valid @RequestBody MoveRequestBody body) {
        log.info("Received roster move: userId={}, drop={}, add={}",
                body.getUserId(), body.getDropPlayerId(), body.getAddPlayerId());

        MoveResult result = moveService.executeMove(MoveRequest.builder()
                .leagueId(leagueId)
                .userId(body.getUserId())
                .releasePlayerId(body.getDropPlayerId())
                .acquirePlayerId(body.getAddPlayerId())
                .build());

        return ResponseEntity.status(httpStatusFor(result))
                .body(MoveResponse.from(result));
    }

    @GetMapping("/teams/{teamId}/roster")
    public ResponseEntity<RosterResponse> getRoster(@PathVariable("leagueId") UUID leagueId,
                                                    @PathVariable("teamId") UUID teamId) {
        if (!leagueDirectory.teamBelongsToLeague(leagueId, teamId)) {
            return ResponseEntity.notFound().build();
        }
        int maxSize = leagueDirectory.getSettings(leagueId).maxRosterSize();
        return ResponseEntity.ok(RosterResponse.from(leagueId, teamId, maxSize,
                ownershipLedger.findRoster(leagueId, teamId)));
    }

    @GetMapping("/transactions")
    public List<TransactionResponse> getTransactions(@PathVariable("leagueId") UUID leagueId,
                                                     @RequestParam(name = "limit", defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_TRANSACTION_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_TRANSACTION_LIMIT);
        }
        return transactionLog.findRecent(leagueId, limit).stream()
                .map(TransactionResponse::from)
                .toList();
    }

    static HttpStatus httpStatusFor(MoveResult result) {
        if (result.getFailureCategory() == FailureCategory.UNEXPECTED) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (result.getStatus()) {
            case SUCCESS -> HttpStatus.OK;
            case DUPLICATE_PLAYER, NOT_OWNED -> HttpStatus.CONFLICT;
            case ROSTER_FULL, ON_COOLDOWN -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NO_TEAM -> HttpStatus.NOT_FOUND;
            case ERROR -> HttpStatus.BAD_REQUEST;
        };
    }
}
