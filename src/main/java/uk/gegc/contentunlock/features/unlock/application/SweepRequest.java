package uk.gegc.contentunlock.features.unlock.application;

/**
 * Sweep trigger. Null tuning values fall back to {@link UnlockSweepProperties}.
 *
 * @param force skip the cooldown check; a sweep already in flight is still joined
 */
public record SweepRequest(
        boolean force,
        SweepMode mode,
        Integer batchSize,
        Long processingStaleMs,
        Long minIntervalMs,
        String traceId
) {
    public SweepRequest {
        if (mode == null) {
            mode = SweepMode.OPPORTUNISTIC;
        }
    }

    public static SweepRequest of(SweepMode mode, boolean force, String traceId) {
        return new SweepRequest(force, mode, null, null, null, traceId);
    }
}
