package uk.gegc.contentunlock.features.unlock.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.contentunlock.features.unlock.application.ReserveOutcome;
import uk.gegc.contentunlock.features.unlock.application.SweepSummary;
import uk.gegc.contentunlock.features.unlock.application.UnlockMetricsService;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-backed unlock metrics.
 */
@Slf4j
@Service
public class UnlockMetricsServiceImpl implements UnlockMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter generationSucceededCounter;
    private final Counter sweepRunsCounter;
    private final Counter sweepSkippedCounter;
    private final Counter expiredRecoveredCounter;
    private final Counter processingRecoveredCounter;
    private final Counter orphanJobsRecoveredCounter;
    private final Counter sweepItemFailuresCounter;

    private final AtomicLong lastExpiredCandidates = new AtomicLong();
    private final AtomicLong lastProcessingCandidates = new AtomicLong();

    public UnlockMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.generationSucceededCounter = Counter.builder("unlock.generation.succeeded")
                .description("Number of blueprint generations that completed an unlock")
                .register(meterRegistry);
        this.sweepRunsCounter = Counter.builder("unlock.sweep.runs")
                .description("Number of reliability sweeps that ran")
                .register(meterRegistry);
        this.sweepSkippedCounter = Counter.builder("unlock.sweep.skipped")
                .description("Number of reliability sweeps skipped (disabled or cooldown)")
                .register(meterRegistry);
        this.expiredRecoveredCounter = Counter.builder("unlock.sweep.recovered.expired")
                .description("Expired reservations recovered by the sweep")
                .register(meterRegistry);
        this.processingRecoveredCounter = Counter.builder("unlock.sweep.recovered.processing")
                .description("Stale processing unlocks recovered by the sweep")
                .register(meterRegistry);
        this.orphanJobsRecoveredCounter = Counter.builder("unlock.sweep.recovered.orphan_jobs")
                .description("Orphan generation jobs failed by the sweep")
                .register(meterRegistry);
        this.sweepItemFailuresCounter = Counter.builder("unlock.sweep.item_failures")
                .description("Rows the sweep failed to recover")
                .register(meterRegistry);

        Gauge.builder("unlock.sweep.backlog.expired", lastExpiredCandidates, AtomicLong::get)
                .description("Expired reservations seen by the last sweep")
                .register(meterRegistry);
        Gauge.builder("unlock.sweep.backlog.processing", lastProcessingCandidates, AtomicLong::get)
                .description("Processing unlocks inspected by the last sweep")
                .register(meterRegistry);
    }

    @Override
    public void incrementReserveOutcome(ReserveOutcome.State state, boolean reservedNow) {
        meterRegistry.counter("unlock.reserve.outcomes",
                "state", state.name(),
                "reserved_now", String.valueOf(reservedNow)).increment();
    }

    @Override
    public void incrementGenerationSucceeded() {
        generationSucceededCounter.increment();
    }

    @Override
    public void incrementGenerationFailed(String errorCode) {
        meterRegistry.counter("unlock.generation.failed", "code", errorCode != null ? errorCode : "UNKNOWN").increment();
    }

    @Override
    public void recordSweep(SweepSummary summary) {
        if (summary.skipped()) {
            sweepSkippedCounter.increment();
            return;
        }
        sweepRunsCounter.increment();
        expiredRecoveredCounter.increment(summary.expiredRecovered());
        processingRecoveredCounter.increment(summary.processingRecovered());
        orphanJobsRecoveredCounter.increment(summary.orphanJobsRecovered());
        sweepItemFailuresCounter.increment(summary.failedItems());
        lastExpiredCandidates.set(summary.inspected().expiredCandidates());
        lastProcessingCandidates.set(summary.inspected().processingCandidates());
        log.debug("Sweep metrics recorded: {}", summary);
    }
}
