package uk.gegc.contentunlock.features.unlock.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Reliability sweep configuration. Out-of-range values are clamped when a sweep starts.
 */
@Configuration
@ConfigurationProperties(prefix = "unlock.sweep")
@Validated
@Data
public class UnlockSweepProperties {

    private boolean enabled = true;

    /**
     * Rows inspected per pass (10..1000).
     */
    private int batchSize = 100;

    /**
     * Age after which PROCESSING work and running jobs count as stale (1 minute..24 hours).
     */
    private long processingStaleMs = 10 * 60_000L;

    /**
     * Minimum gap between two non-forced sweeps (1 second..10 minutes).
     */
    private long minIntervalMs = 30_000L;

    /**
     * Emit a trace event per recovered row in addition to the summary.
     */
    private boolean dryLogs = true;

    /**
     * Delay between scheduled sweeps, and before the first one.
     */
    private long fixedDelayMs = 60_000L;

    private long initialDelayMs = 30_000L;
}
