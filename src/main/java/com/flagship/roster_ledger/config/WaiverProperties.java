package com.flagship.roster_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Waiver processing settings.
 *
 * League rows carry their own cooldown and processing time; the values here
 * are the fallbacks and the knobs of the scheduled run.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "roster.waivers")
public class WaiverProperties {

    /** Upper bound on claims resolved per league per run. */
    private int defaultBatchSize = 100;

    private int defaultCooldownHours = 48;

    /** Zone in which league processing times are expressed. */
    private String processZone = "America/New_York";

    private Scheduler scheduler = new Scheduler();

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private String cron = "0 */5 * * * *";
        private int dueWindowMinutes = 5;
    }
}
