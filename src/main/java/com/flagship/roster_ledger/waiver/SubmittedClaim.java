package com.flagship.roster_ledger.waiver;

import lombok.Value;

/**
 * A claim returned from submission. {@code created} is false when an earlier
 * submission with the same idempotency key is being replayed.
 */
@Value
public class SubmittedClaim {
    Claim claim;
    boolean created;
}
