package uk.gegc.contentunlock.features.credits.application;

import java.math.BigDecimal;

/**
 * Metrics emitted by the credit ledger.
 */
public interface CreditMetricsService {

    void incrementHoldPlaced(BigDecimal amount);

    void incrementHoldReplayed();

    void incrementInsufficientCredits();

    void incrementSettled(BigDecimal settledAmount, BigDecimal releasedAmount);

    void incrementRefunded(BigDecimal amount);

    void incrementWalletCasConflict();
}
