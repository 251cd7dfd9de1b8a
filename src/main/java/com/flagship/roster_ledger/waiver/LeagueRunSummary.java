package com.flagship.roster_ledger.waiver;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Result of one league's waiver run.
 */
@Value
public class LeagueRunSummary {
    UUID leagueId;
    int processed;
    int successful;
    int failed;
    List<ClaimOutcome> outcomes;

    public static LeagueRunSummary of(UUID leagueId, List<ClaimOutcome> outcomes) {
        int successful = (int) outcomes.stream().filter(ClaimOutcome::isSuccessful).count();
        return new LeagueRunSummary(leagueId, outcomes.size(), successful, outcomes.size() - successful, outcomes);
    }
}
