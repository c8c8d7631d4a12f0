package uk.gegc.contentunlock.features.unlock.api.dto;

import uk.gegc.contentunlock.features.unlock.application.SweepMode;

import java.time.LocalDateTime;

public record SweepSummaryDto(
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
        int expiredCandidates,
        int processingCandidates,
        int runningJobs
) {}
