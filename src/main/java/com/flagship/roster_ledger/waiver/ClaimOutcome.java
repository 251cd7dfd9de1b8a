package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.audit.FailureCategory;
import lombok.Value;

import java.util.UUID;

/**
 * How one claim of a waiver run was resolved.
 */
@Value
public class ClaimOutcome {
    UUID claimId;
    UUID teamId;
    String playerId;
    ClaimStatus status;
    /** Null for successful claims. */
    String reason;
    /** Null for successful claims. */
    FailureCategory failureCategory;

    public static ClaimOutcome successful(PendingClaim claim) {
        return new ClaimOutcome(claim.getClaimId(), claim.getTeamId(), claim.getPlayerId(),
                ClaimStatus.SUCCESSFUL, null, null);
    }

    public static ClaimOutcome failed(PendingClaim claim, FailureCategory category, String reason) {
        return new ClaimOutcome(claim.getClaimId(), claim.getTeamId(), claim.getPlayerId(),
                ClaimStatus.FAILED, reason, category);
    }

    public boolean isSuccessful() {
        return status == ClaimStatus.SUCCESSFUL;
    }
}
