package uk.gegc.contentunlock.features.unlock.application;

import java.util.UUID;

/**
 * Idempotency keys and reason codes for unlock ledger writes.
 *
 * <p>Refund and settle keys are derived from the hold's ledger id, so every path that can
 * refund a hold (worker failure, sweep, reclaim) collides on the same key and a hold is
 * refunded at most once.
 */
public final class UnlockLedgerKeys {

    public static final String HOLD_REASON = "UNLOCK_HOLD";
    public static final String SETTLE_REASON = "UNLOCK_SETTLED";
    public static final String GENERATION_FAILED_REFUND = "UNLOCK_GENERATION_FAILED_REFUND";
    public static final String RESERVATION_EXPIRED_REFUND = "UNLOCK_RESERVATION_EXPIRED_REFUND";
    public static final String PROCESSING_STALE_REFUND = "UNLOCK_PROCESSING_STALE_REFUND";
    public static final String RESERVATION_RECLAIMED_REFUND = "UNLOCK_RESERVATION_RECLAIMED_REFUND";
    public static final String ATTACH_FAILED_REFUND = "UNLOCK_ATTACH_FAILED_REFUND";

    private UnlockLedgerKeys() {
    }

    /**
     * One hold per reservation: the version the unlock reached when this user reserved it.
     */
    public static String holdKey(UUID unlockId, UUID userId, long reservationVersion) {
        return "unlock:" + unlockId + ":hold:" + userId + ":" + reservationVersion;
    }

    public static String refundKey(UUID unlockId, UUID holdLedgerId) {
        return "unlock:" + unlockId + ":refund:" + holdLedgerId;
    }

    public static String settleKey(UUID unlockId, UUID holdLedgerId) {
        return "unlock:" + unlockId + ":settle:" + holdLedgerId;
    }
}
