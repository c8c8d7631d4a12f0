package uk.gegc.contentunlock.features.unlock.application;

/**
 * Metrics emitted by the unlock flow and the reliability sweep.
 */
public interface UnlockMetricsService {

    void incrementReserveOutcome(ReserveOutcome.State state, boolean reservedNow);

    void incrementGenerationSucceeded();

    void incrementGenerationFailed(String errorCode);

    void recordSweep(SweepSummary summary);
}
