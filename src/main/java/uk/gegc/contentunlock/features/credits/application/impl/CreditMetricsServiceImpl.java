package uk.gegc.contentunlock.features.credits.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.contentunlock.features.credits.application.CreditMetricsService;

import java.math.BigDecimal;

/**
 * Micrometer-backed ledger metrics.
 */
@Service
public class CreditMetricsServiceImpl implements CreditMetricsService {

    private final Counter holdsPlacedCounter;
    private final Counter holdsReplayedCounter;
    private final Counter insufficientCounter;
    private final Counter settlesCounter;
    private final Counter refundsCounter;
    private final Counter casConflictCounter;
    private final Counter creditsHeldCounter;
    private final Counter creditsSettledCounter;
    private final Counter creditsReleasedCounter;
    private final Counter creditsRefundedCounter;

    public CreditMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.holdsPlacedCounter = Counter.builder("credits.holds.placed")
                .description("Number of credit holds placed")
                .register(meterRegistry);
        this.holdsReplayedCounter = Counter.builder("credits.holds.replayed")
                .description("Number of hold requests answered from an existing ledger entry")
                .register(meterRegistry);
        this.insufficientCounter = Counter.builder("credits.holds.insufficient")
                .description("Number of holds rejected for insufficient balance")
                .register(meterRegistry);
        this.settlesCounter = Counter.builder("credits.settles")
                .description("Number of holds settled")
                .register(meterRegistry);
        this.refundsCounter = Counter.builder("credits.refunds")
                .description("Number of holds refunded")
                .register(meterRegistry);
        this.casConflictCounter = Counter.builder("credits.wallet.cas.conflicts")
                .description("Number of lost wallet compare-and-set races")
                .register(meterRegistry);
        this.creditsHeldCounter = Counter.builder("credits.amount.held")
                .description("Credits debited by holds")
                .register(meterRegistry);
        this.creditsSettledCounter = Counter.builder("credits.amount.settled")
                .description("Credits finally charged by settles")
                .register(meterRegistry);
        this.creditsReleasedCounter = Counter.builder("credits.amount.released")
                .description("Credits returned by partial settles")
                .register(meterRegistry);
        this.creditsRefundedCounter = Counter.builder("credits.amount.refunded")
                .description("Credits returned by refunds")
                .register(meterRegistry);
    }

    @Override
    public void incrementHoldPlaced(BigDecimal amount) {
        holdsPlacedCounter.increment();
        creditsHeldCounter.increment(amount.doubleValue());
    }

    @Override
    public void incrementHoldReplayed() {
        holdsReplayedCounter.increment();
    }

    @Override
    public void incrementInsufficientCredits() {
        insufficientCounter.increment();
    }

    @Override
    public void incrementSettled(BigDecimal settledAmount, BigDecimal releasedAmount) {
        settlesCounter.increment();
        creditsSettledCounter.increment(settledAmount.doubleValue());
        if (releasedAmount.signum() > 0) {
            creditsReleasedCounter.increment(releasedAmount.doubleValue());
        }
    }

    @Override
    public void incrementRefunded(BigDecimal amount) {
        refundsCounter.increment();
        creditsRefundedCounter.increment(amount.doubleValue());
    }

    @Override
    public void incrementWalletCasConflict() {
        casConflictCounter.increment();
    }
}
