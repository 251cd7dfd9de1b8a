package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Triggers waiver runs for leagues whose processing time has come.
 *
 * The cron should fire at least once per due window; an overlapping run for
 * the same league is a no-op because of the league lock.
 */
@Component
@ConditionalOnProperty(name = "roster.waivers.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WaiverProcessingScheduler {

    private final WaiverRunService waiverRunService;

    @Scheduled(cron = "${roster.waivers.scheduler.cron:0 */5 * * * *}")
    public void processDueLeagues() {
        CorrelationContext.setCorrelationId(CorrelationContext.generateCorrelationId());
        try {
            List<LeagueRunSummary> summaries = waiverRunService.processDueLeagues();
            if (!summaries.isEmpty()) {
                log.info("Scheduled waiver processing covered {} league(s)", summaries.size());
            }
        } catch (Exception e) {
            log.error("Error in scheduled waiver processing", e);
        } finally {
            CorrelationContext.clear();
        }
    }
}
