package uk.gegc.contentunlock.features.unlock.application;

import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;

import java.util.Optional;

/**
 * Result of a reservation attempt.
 *
 * @param reservedNow true only for the caller whose write moved the unlock to RESERVED
 * @param reclaimed   snapshot of an expired reservation this call released, if any. Its hold
 *                    still has to be refunded by the caller.
 */
public record ReserveOutcome(
        State state,
        Unlock unlock,
        boolean reservedNow,
        Unlock reclaimed
) {
    public enum State {
        READY,
        IN_PROGRESS,
        RESERVED
    }

    public Optional<Unlock> reclaimedReservation() {
        return Optional.ofNullable(reclaimed);
    }
}
