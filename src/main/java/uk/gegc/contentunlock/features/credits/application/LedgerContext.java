package uk.gegc.contentunlock.features.credits.application;

import java.util.Map;
import java.util.UUID;

/**
 * Free-form audit context written alongside a ledger entry.
 */
public record LedgerContext(
        UUID unlockId,
        String sourceItemId,
        String sourcePageId,
        String traceId,
        Map<String, Object> metadata
) {
    public static LedgerContext empty() {
        return new LedgerContext(null, null, null, null, Map.of());
    }

    public static LedgerContext forUnlock(UUID unlockId, String sourceItemId, String sourcePageId, String traceId) {
        return new LedgerContext(unlockId, sourceItemId, sourcePageId, traceId, Map.of());
    }
}
