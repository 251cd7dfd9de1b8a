package com.flagship.roster_ledger.waiver;

import java.util.Comparator;
import java.util.Locale;

/**
 * How a league orders competing claims and what happens to priority after a
 * successful claim.
 *
 * Within equal rank, earlier claims win; the claim id breaks exact ties so the
 * order is total.
 */
public enum WaiverPolicy {

    /**
     * Rank 1 claims first. A team whose claim succeeds moves to the back.
     */
    ROTATING {
        @Override
        public Comparator<PendingClaim> processingOrder() {
            return Comparator.comparingInt(PendingClaim::getTeamRank)
                    .thenComparing(TIE_BREAK);
        }

        @Override
        public boolean rotatesOnSuccess() {
            return true;
        }
    },

    /**
     * Highest rank number claims first. Ranks are maintained externally from
     * standings and are left alone after a claim.
     */
    REVERSE_STANDINGS {
        @Override
        public Comparator<PendingClaim> processingOrder() {
            return Comparator.comparingInt(PendingClaim::getTeamRank).reversed()
                    .thenComparing(TIE_BREAK);
        }

        @Override
        public boolean rotatesOnSuccess() {
            return false;
        }
    },

    /**
     * Sealed-bid budget allocation. Not yet supported.
     */
    BUDGET_BID {
        @Override
        public Comparator<PendingClaim> processingOrder() {
            throw new UnsupportedOperationException("Budget-bid waiver processing is not yet supported");
        }

        @Override
        public boolean rotatesOnSuccess() {
            return false;
        }
    };

    private static final Comparator<PendingClaim> TIE_BREAK =
            Comparator.comparing(PendingClaim::getCreatedAt)
                    .thenComparing(PendingClaim::getClaimId);

    /**
     * @throws UnsupportedOperationException for policies that cannot be processed yet
     */
    public abstract Comparator<PendingClaim> processingOrder();

    public abstract boolean rotatesOnSuccess();

    /**
     * Parses a stored policy code. Also accepts the older lower-case names
     * ("rolling", "reverse_standings", "faab").
     */
    public static WaiverPolicy fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ROTATING;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "rotating", "rolling" -> ROTATING;
            case "reverse_standings" -> REVERSE_STANDINGS;
            case "budget_bid", "faab" -> BUDGET_BID;
            default -> throw new IllegalArgumentException("Unknown waiver policy: " + code);
        };
    }
}
