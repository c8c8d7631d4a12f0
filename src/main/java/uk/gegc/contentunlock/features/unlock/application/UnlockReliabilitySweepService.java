package uk.gegc.contentunlock.features.unlock.application;

/**
 * Heals unlocks and jobs left inconsistent by crashes or timeouts: expired reservations,
 * stale processing rows and running jobs nobody points at anymore.
 */
public interface UnlockReliabilitySweepService {

    /**
     * Runs a sweep unless disabled or inside the cooldown. Concurrent callers share one run.
     */
    SweepSummary runSweep(SweepRequest request);

    /**
     * Opportunistic trigger: runs with defaults if the cooldown has passed, otherwise returns a skip.
     */
    SweepSummary runSweepIfDue(String traceId);
}
