package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.expiry.ExpiryTracker;
import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.ledger.OwnershipLedger;
import com.flagship.roster_ledger.move.MoveRequest;
import com.flagship.roster_ledger.move.MoveResult;
import com.flagship.roster_ledger.move.MoveStatus;
import com.flagship.roster_ledger.move.RosterMoveService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Adds a player the way a user expects: directly when the player is a free
 * agent, through a waiver claim while the player is on waivers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerAcquisitionService {

    private final OwnershipLedger ownershipLedger;
    private final ExpiryTracker expiryTracker;
    private final LeagueDirectory leagueDirectory;
    private final RosterMoveService moveService;
    private final ClaimService claimService;

    public PlayerAvailability checkAvailability(UUID leagueId, String playerId) {
        Optional<UUID> owner = ownershipLedger.findOwner(leagueId, playerId);
        if (owner.isPresent()) {
            return PlayerAvailability.builder()
                    .playerId(playerId)
                    .available(false)
                    .rostered(true)
                    .ownerTeamId(owner.get())
                    .lockReason("Player is already on a team in this league")
                    .build();
        }

        if (expiryTracker.isOnCooldown(leagueId, playerId)) {
            Optional<Instant> clearsAt = expiryTracker.getClearTime(leagueId, playerId);
            return PlayerAvailability.builder()
                    .playerId(playerId)
                    .available(false)
                    .onWaivers(true)
                    .waiversClearAt(clearsAt.orElse(null))
                    .lockReason(clearsAt
                            .map(at -> "Player is on waivers until " + at)
                            .orElse("Player is on waivers"))
                    .build();
        }

        return PlayerAvailability.builder()
                .playerId(playerId)
                .available(true)
                .build();
    }

    /**
     * Adds a free agent directly, or files a waiver claim if the player is on
     * waivers. A rostered player is rejected without touching the ledger.
     */
    public AddPlayerResult addPlayer(UUID leagueId, UUID userId, String playerId, String dropPlayerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player to add is required");
        }
        PlayerAvailability availability = checkAvailability(leagueId, playerId.trim());

        if (availability.isRostered()) {
            return AddPlayerResult.rejected(availability.getLockReason());
        }
        if (availability.isOnWaivers()) {
            return submitClaim(leagueId, userId, playerId, dropPlayerId);
        }

        MoveResult result = moveService.executeMove(MoveRequest.builder()
                .leagueId(leagueId)
                .userId(userId)
                .releasePlayerId(dropPlayerId)
                .acquirePlayerId(playerId)
                .source(MoveRequest.SOURCE_FREE_AGENTS)
                .build());

        // the player went on waivers between the check and the move
        if (result.getStatus() == MoveStatus.ON_COOLDOWN) {
            return submitClaim(leagueId, userId, playerId, dropPlayerId);
        }
        return AddPlayerResult.moved(result);
    }

    private AddPlayerResult submitClaim(UUID leagueId, UUID userId, String playerId, String dropPlayerId) {
        Optional<UUID> teamId = leagueDirectory.findTeamForUser(leagueId, userId);
        if (teamId.isEmpty()) {
            return AddPlayerResult.rejected("User does not have a team in this league");
        }
        SubmittedClaim submitted = claimService.submitClaim(leagueId, teamId.get(), playerId, dropPlayerId, null);
        log.info("Player {} is on waivers, filed claim {} instead of a direct add", playerId,
                submitted.getClaim().getId());
        return AddPlayerResult.claimed(submitted.getClaim(), "Player is on waivers, waiver claim submitted");
    }
}
