package uk.gegc.contentunlock.features.credits.application;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input to every mutating ledger operation. The idempotency key identifies the operation
 * across retries; replaying it returns the original outcome.
 */
public record LedgerRequest(
        UUID userId,
        BigDecimal amount,
        String idempotencyKey,
        String reasonCode,
        LedgerContext context
) {
    public LedgerRequest {
        if (context == null) {
            context = LedgerContext.empty();
        }
    }
}
