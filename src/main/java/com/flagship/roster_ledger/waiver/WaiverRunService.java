package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.config.WaiverProperties;
import com.flagship.roster_ledger.expiry.ExpiryTracker;
import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.league.LeagueSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs waiver processing across leagues and reports when each league is due.
 *
 * League processing times are wall-clock times in the configured zone
 * ({@code roster.waivers.process-zone}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WaiverRunService {

    private final ClaimProcessor claimProcessor;
    private final ClaimBatchRepository batchRepository;
    private final LeagueDirectory leagueDirectory;
    private final ExpiryTracker expiryTracker;
    private final WaiverProperties properties;
    private final Clock clock;

    /**
     * Processes every league with pending claims, regardless of its
     * processing time, then closes expired waiver windows.
     */
    public List<LeagueRunSummary> processAllPending() {
        return processLeagues(leagueDirectory.findLeaguesWithPendingClaims());
    }

    /**
     * Processes only the leagues whose processing time falls within the due
     * window around now.
     */
    public List<LeagueRunSummary> processDueLeagues() {
        return processLeagues(findLeaguesDueForProcessing(clock.instant()));
    }

    /**
     * Leagues with pending claims whose daily processing time is within
     * {@code roster.waivers.scheduler.due-window-minutes} of {@code now}.
     */
    public List<LeagueSettings> findLeaguesDueForProcessing(Instant now) {
        Duration window = Duration.ofMinutes(properties.getScheduler().getDueWindowMinutes());
        return leagueDirectory.findLeaguesWithPendingClaims().stream()
                .filter(league -> isDue(league, now, window))
                .toList();
    }

    public List<LeagueProcessingStatus> getProcessingStatus() {
        Instant now = clock.instant();
        Map<UUID, Long> pending = batchRepository.countPendingByLeague();
        List<LeagueProcessingStatus> statuses = new ArrayList<>(pending.size());
        pending.forEach((leagueId, count) -> {
            LeagueSettings settings = leagueDirectory.getSettings(leagueId);
            statuses.add(new LeagueProcessingStatus(
                    leagueId,
                    count,
                    batchRepository.findLastProcessedAt(leagueId).orElse(null),
                    nextProcessingTime(settings, now)
            ));
        });
        return statuses;
    }

    Instant nextProcessingTime(LeagueSettings settings, Instant now) {
        ZonedDateTime local = now.atZone(zone());
        ZonedDateTime next = local.with(settings.getProcessTime());
        if (next.isBefore(local)) {
            next = next.plusDays(1).with(settings.getProcessTime());
        }
        return next.toInstant();
    }

    private List<LeagueRunSummary> processLeagues(List<LeagueSettings> leagues) {
        List<LeagueRunSummary> summaries = new ArrayList<>(leagues.size());
        for (LeagueSettings league : leagues) {
            try {
                List<ClaimOutcome> outcomes = claimProcessor.processClaims(
                        league.getLeagueId(), properties.getDefaultBatchSize());
                summaries.add(LeagueRunSummary.of(league.getLeagueId(), outcomes));
            } catch (RuntimeException e) {
                log.error("Waiver run failed for league {}", league.getLeagueId(), e);
            }
        }

        int swept = expiryTracker.sweepExpired();
        log.info("Waiver processing finished: leagues={}, claims={}, windowsClosed={}",
                summaries.size(),
                summaries.stream().mapToInt(LeagueRunSummary::getProcessed).sum(),
                swept);
        return summaries;
    }

    private boolean isDue(LeagueSettings league, Instant now, Duration window) {
        ZonedDateTime local = now.atZone(zone());
        ZonedDateTime today = local.with(league.getProcessTime());
        for (ZonedDateTime candidate : List.of(today.minusDays(1), today, today.plusDays(1))) {
            if (Duration.between(candidate, local).abs().compareTo(window) < 0) {
                return true;
            }
        }
        return false;
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getProcessZone());
    }
}
