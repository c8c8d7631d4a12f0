package uk.gegc.contentunlock.features.unlock.application;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Unlock price: one credit shared across the item's active subscribers, between 0.05 and 1.0.
 */
public final class UnlockPricing {

    public static final BigDecimal MIN_UNLOCK_COST = new BigDecimal("0.050");
    public static final BigDecimal MAX_UNLOCK_COST = new BigDecimal("1.000");

    private UnlockPricing() {
    }

    public static BigDecimal computeUnlockCost(long activeSubscriberCount) {
        long normalized = Math.max(1L, activeSubscriberCount);
        BigDecimal raw = BigDecimal.ONE.divide(BigDecimal.valueOf(normalized), 3, RoundingMode.HALF_UP);
        return raw.max(MIN_UNLOCK_COST).min(MAX_UNLOCK_COST).setScale(3, RoundingMode.HALF_UP);
    }

    public static BigDecimal round3(BigDecimal value) {
        return value.setScale(3, RoundingMode.HALF_UP);
    }
}
