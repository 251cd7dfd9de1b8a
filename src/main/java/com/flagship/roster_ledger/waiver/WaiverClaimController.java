package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.config.WaiverProperties;
import com.flagship.roster_ledger.priority.PriorityRotationTable;
import com.flagship.roster_ledger.waiver.dto.CancelClaimResponse;
import com.flagship.roster_ledger.waiver.dto.ClaimResponse;
import com.flagship.roster_ledger.waiver.dto.PriorityResponse;
import com.flagship.roster_ledger.waiver.dto.RunSummaryResponse;
import com.flagship.roster_ledger.waiver.dto.SubmitClaimRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Waiver claims of one league: filing, cancelling, listing and an on-demand
 * run of the league's queue.
 */
@RestController
@RequestMapping("/api/leagues/{leagueId}")
@RequiredArgsConstructor
@Slf4j
public class WaiverClaimController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ClaimService claimService;
    private final ClaimProcessor claimProcessor;
    private final PriorityRotationTable priorityTable;
    private final WaiverProperties waiverProperties;

    /**
     * Files a claim. Replaying a request with the same {@code Idempotency-Key}
     * returns the original claim with 200 instead of 201.
     */
    @PostMapping("/claims")
    public ResponseEntity<ClaimResponse> submitClaim(
            @PathVariable("leagueId") UUID leagueId,
            @Valid @RequestBody SubmitClaimRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received waiver claim: teamId={}, playerId={}, dropPlayerId={}",
                request.getTeamId(), request.getPlayerId(), request.getDropPlayerId());

        SubmittedClaim submitted = claimService.submitClaim(leagueId, request.getTeamId(),
                request.getPlayerId(), request.getDropPlayerId(), idempotencyKey);

        return ResponseEntity.status(submitted.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(ClaimResponse.from(submitted.getClaim()));
    }

    @DeleteMapping("/teams/{teamId}/claims/{claimId}")
    public ResponseEntity<CancelClaimResponse> cancelClaim(@PathVariable("leagueId") UUID leagueId,
                                                           @PathVariable("teamId") UUID teamId,
                                                           @PathVariable("claimId") UUID claimId) {
        CancelResult result = claimService.cancelClaim(leagueId, teamId, claimId);
        HttpStatus status = switch (result) {
            case CANCELLED -> HttpStatus.OK;
            case ALREADY_FINAL -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
        return ResponseEntity.status(status).body(new CancelClaimResponse(claimId, result));
    }

    @GetMapping("/teams/{teamId}/claims")
    public List<ClaimResponse> getPendingClaims(@PathVariable("leagueId") UUID leagueId,
                                                @PathVariable("teamId") UUID teamId) {
        return claimService.findPendingClaims(leagueId, teamId).stream()
                .map(ClaimResponse::from)
                .toList();
    }

    @GetMapping("/claims/{claimId}")
    public ResponseEntity<ClaimResponse> getClaim(@PathVariable("leagueId") UUID leagueId,
                                                  @PathVariable("claimId") UUID claimId) {
        return claimService.findClaim(claimId)
                .filter(claim -> claim.getLeagueId().equals(leagueId))
                .map(claim -> ResponseEntity.ok(ClaimResponse.from(claim)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/claims/process")
    public RunSummaryResponse processClaims(@PathVariable("leagueId") UUID leagueId,
                                            @RequestParam(name = "batch_size", required = false) Integer batchSize) {
        int size = batchSize != null ? batchSize : waiverProperties.getDefaultBatchSize();
        List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, size);
        return RunSummaryResponse.from(LeagueRunSummary.of(leagueId, outcomes));
    }

    @GetMapping("/priority")
    public List<PriorityResponse> getPriorityOrder(@PathVariable("leagueId") UUID leagueId) {
        return priorityTable.findOrder(leagueId).stream()
                .map(PriorityResponse::from)
                .toList();
    }
}
