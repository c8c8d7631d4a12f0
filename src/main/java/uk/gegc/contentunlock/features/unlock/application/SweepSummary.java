package uk.gegc.contentunlock.features.unlock.application;

import java.time.LocalDateTime;

public record SweepSummary(
        boolean skipped,
        String skipReason,
        SweepMode mode,
        String traceId,
        LocalDateTime runStartedAt,
        LocalDateTime runFinishedAt,
        int expiredRecovered,
        int processingRecovered,
        int orphanJobsRecovered,
        int failedItems,
        Inspected inspected
) {
    public static final String SKIP_DISABLED = "disabled";
    public static final String SKIP_COOLDOWN = "cooldown";

    public record Inspected(int expiredCandidates, int processingCandidates, int runningJobs) {
        public static Inspected none() {
            return new Inspected(0, 0, 0);
        }
    }

    public static SweepSummary skipped(String reason, SweepMode mode, String traceId) {
        return new SweepSummary(true, reason, mode, traceId, null, null, 0, 0, 0, 0, Inspected.none());
    }
}
