package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.waiver.dto.AddPlayerRequest;
import com.flagship.roster_ledger.waiver.dto.AddPlayerResponse;
import com.flagship.roster_ledger.waiver.dto.AvailabilityResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/leagues/{leagueId}")
@RequiredArgsConstructor
public class PlayerAcquisitionController {

    private final PlayerAcquisitionService acquisitionService;

    @GetMapping("/players/{playerId}/availability")
    public AvailabilityResponse getAvailability(@PathVariable("leagueId") UUID leagueId,
                                                @PathVariable("playerId") String playerId) {
        return AvailabilityResponse.from(acquisitionService.checkAvailability(leagueId, playerId));
    }

    @PostMapping("/adds")
    public ResponseEntity<AddPlayerResponse> addPlayer(@PathVariable("leagueId") UUID leagueId,
                                                       @Valid @RequestBody AddPlayerRequest request) {
        AddPlayerResult result = acquisitionService.addPlayer(leagueId, request.getUserId(),
                request.getPlayerId(), request.getDropPlayerId());
        HttpStatus status = switch (result.getAction()) {
            case ADDED -> HttpStatus.OK;
            case CLAIM_SUBMITTED -> HttpStatus.ACCEPTED;
            case REJECTED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(AddPlayerResponse.from(result));
    }
}
