package uk.gegc.contentunlock.features.credits.application;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of a settle or refund. {@code applied} is false when the idempotency key had
 * already been written and nothing moved this time.
 */
public record LedgerWriteResult(
        UUID ledgerId,
        boolean applied,
        boolean bypass,
        BigDecimal balanceAfter
) {
    public static LedgerWriteResult bypassed() {
        return new LedgerWriteResult(null, false, true, null);
    }
}
