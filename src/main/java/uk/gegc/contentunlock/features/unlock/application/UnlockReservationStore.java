package uk.gegc.contentunlock.features.unlock.application;

import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Compare-and-set state machine over {@link Unlock} rows:
 * AVAILABLE, RESERVED, PROCESSING, READY. This store never moves credits.
 */
public interface UnlockReservationStore {

    /**
     * Returns the unlock for the item, creating it AVAILABLE on first sight. The cost is
     * refreshed only while the unlock is AVAILABLE; the page id whenever a new one is given.
     */
    Unlock ensureUnlock(String sourceItemId, String sourcePageId, BigDecimal estimatedCost);

    ReserveOutcome reserve(Unlock unlock, UUID userId, BigDecimal estimatedCost, int reservationSeconds);

    /**
     * Links the credit hold to a reservation still held by {@code userId}.
     *
     * @return empty when the reservation is no longer this user's
     */
    Optional<Unlock> attachReservationLedger(UUID unlockId, UUID userId, UUID ledgerId, BigDecimal amount);

    /**
     * RESERVED to PROCESSING, only for the reserving user and only before the reservation expires.
     */
    Optional<Unlock> markProcessing(UUID unlockId, UUID userId, UUID jobId);

    Unlock completeUnlock(UUID unlockId, UUID blueprintId, UUID jobId);

    /**
     * Same as {@link #completeUnlock} but only if the row has not changed since {@code observed} was read.
     */
    Optional<Unlock> completeUnlockIfUnchanged(Unlock observed, UUID blueprintId, UUID jobId);

    /**
     * Back to AVAILABLE with the error recorded. Credits are the caller's business.
     */
    Unlock failUnlock(UUID unlockId, String errorCode, String errorMessage);

    /**
     * Same as {@link #failUnlock} but only if the row has not changed since {@code observed} was read.
     */
    Optional<Unlock> failUnlockIfUnchanged(Unlock observed, String errorCode, String errorMessage);

    List<Unlock> findExpiredReserved(int limit);

    List<Unlock> listProcessing(int limit);

    /**
     * Number of RESERVED or PROCESSING unlocks pointing at each job. Jobs with none are absent.
     */
    Map<UUID, Long> countActiveLinksForJobs(Collection<UUID> jobIds);

    Optional<Unlock> findById(UUID unlockId);

    Optional<Unlock> findBySourceItemId(String sourceItemId);

    List<Unlock> findBySourceItemIds(Collection<String> sourceItemIds);
}
