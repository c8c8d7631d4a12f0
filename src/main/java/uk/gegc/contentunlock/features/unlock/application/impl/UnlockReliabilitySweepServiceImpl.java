package uk.gegc.contentunlock.features.unlock.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.application.LedgerContext;
import uk.gegc.contentunlock.features.credits.application.LedgerRequest;
import uk.gegc.contentunlock.features.jobs.application.JobLeaseStore;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.jobs.domain.model.JobStatus;
import uk.gegc.contentunlock.features.unlock.application.SweepMode;
import uk.gegc.contentunlock.features.unlock.application.SweepRequest;
import uk.gegc.contentunlock.features.unlock.application.SweepSummary;
import uk.gegc.contentunlock.features.unlock.application.UnlockLedgerKeys;
import uk.gegc.contentunlock.features.unlock.application.UnlockMetricsService;
import uk.gegc.contentunlock.features.unlock.application.UnlockProperties;
import uk.gegc.contentunlock.features.unlock.application.UnlockReliabilitySweepService;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.application.UnlockSweepProperties;
import uk.gegc.contentunlock.features.unlock.application.UnlockTraceLogger;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Three recovery passes run in order: expired reservations, stale processing rows, orphan jobs.
 *
 * <p>Single flight and cooldown state live in this bean, so they are per process and reset on
 * restart. Two instances may sweep at the same time; every recovery step is either a
 * compare-and-set or an idempotent ledger write, so overlapping sweeps repeat no money movement.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnlockReliabilitySweepServiceImpl implements UnlockReliabilitySweepService {

    static final int MIN_BATCH_SIZE = 10;
    static final int MAX_BATCH_SIZE = 1000;
    static final long MIN_PROCESSING_STALE_MS = 60_000L;
    static final long MAX_PROCESSING_STALE_MS = 24 * 60 * 60_000L;
    static final long MIN_INTERVAL_MS = 1_000L;
    static final long MAX_INTERVAL_MS = 10 * 60_000L;

    static final String EXPIRED_RECOVERED_CODE = "UNLOCK_RESERVATION_EXPIRED_RECOVERED";
    static final String PROCESSING_RECOVERED_CODE = "UNLOCK_PROCESSING_STALE_RECOVERED";
    static final String ORPHAN_JOB_CODE = "ORPHAN_UNLOCK_JOB_RECOVERED";

    private final UnlockReservationStore reservationStore;
    private final CreditLedgerService creditLedgerService;
    private final JobLeaseStore jobLeaseStore;
    private final UnlockSweepProperties sweepProperties;
    private final UnlockProperties unlockProperties;
    private final UnlockTraceLogger traceLogger;
    private final UnlockMetricsService metricsService;
    private final Clock clock;

    private final AtomicReference<CompletableFuture<SweepSummary>> inFlight = new AtomicReference<>();
    private final AtomicReference<LocalDateTime> lastCompletedAt = new AtomicReference<>();

    @Override
    public SweepSummary runSweepIfDue(String traceId) {
        return runSweep(SweepRequest.of(SweepMode.OPPORTUNISTIC, false, traceId));
    }

    @Override
    public SweepSummary runSweep(SweepRequest request) {
        SweepRequest req = request != null ? request : SweepRequest.of(SweepMode.OPPORTUNISTIC, false, null);
        String traceId = UnlockTraceLogger.ensureTraceId(req.traceId());

        if (!sweepProperties.isEnabled()) {
            SweepSummary skipped = SweepSummary.skipped(SweepSummary.SKIP_DISABLED, req.mode(), traceId);
            metricsService.recordSweep(skipped);
            return skipped;
        }

        long minIntervalMs = clamp(req.minIntervalMs() != null ? req.minIntervalMs() : sweepProperties.getMinIntervalMs(),
                MIN_INTERVAL_MS, MAX_INTERVAL_MS);

        while (true) {
            CompletableFuture<SweepSummary> running = inFlight.get();
            if (running != null) {
                log.debug("Sweep already in flight, joining it (trace {})", traceId);
                return await(running);
            }
            if (!req.force() && inCooldown(minIntervalMs)) {
                SweepSummary skipped = SweepSummary.skipped(SweepSummary.SKIP_COOLDOWN, req.mode(), traceId);
                metricsService.recordSweep(skipped);
                return skipped;
            }

            CompletableFuture<SweepSummary> mine = new CompletableFuture<>();
            if (!inFlight.compareAndSet(null, mine)) {
                continue;
            }
            try {
                SweepSummary summary;
                // Another run may have finished between the cooldown check and the claim
                if (!req.force() && inCooldown(minIntervalMs)) {
                    summary = SweepSummary.skipped(SweepSummary.SKIP_COOLDOWN, req.mode(), traceId);
                } else {
                    try {
                        summary = execute(req, traceId);
                    } finally {
                        lastCompletedAt.set(LocalDateTime.now(clock));
                    }
                }
                mine.complete(summary);
                metricsService.recordSweep(summary);
                return summary;
            } catch (RuntimeException ex) {
                mine.completeExceptionally(ex);
                throw ex;
            } finally {
                inFlight.compareAndSet(mine, null);
            }
        }
    }

    private SweepSummary execute(SweepRequest request, String traceId) {
        int batchSize = (int) clamp(request.batchSize() != null ? request.batchSize() : sweepProperties.getBatchSize(),
                MIN_BATCH_SIZE, MAX_BATCH_SIZE);
        long staleMs = clamp(request.processingStaleMs() != null ? request.processingStaleMs() : sweepProperties.getProcessingStaleMs(),
                MIN_PROCESSING_STALE_MS, MAX_PROCESSING_STALE_MS);
        SweepMode mode = request.mode();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        SweepCounters counters = new SweepCounters();

        recoverExpiredReservations(batchSize, mode, traceId, counters);
        recoverStaleProcessing(batchSize, mode, traceId, counters);
        recoverOrphanJobs(batchSize, staleMs, startedAt, mode, traceId, counters);

        SweepSummary summary = new SweepSummary(
                false,
                null,
                mode,
                traceId,
                startedAt,
                LocalDateTime.now(clock),
                counters.expiredRecovered,
                counters.processingRecovered,
                counters.orphanJobsRecovered,
                counters.failedItems,
                new SweepSummary.Inspected(counters.expiredCandidates, counters.processingCandidates, counters.runningJobs)
        );

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("trace_id", traceId);
        payload.put("mode", mode.name().toLowerCase(Locale.ROOT));
        payload.put("dry_logs", sweepProperties.isDryLogs());
        payload.put("run_started_at", summary.runStartedAt());
        payload.put("run_finished_at", summary.runFinishedAt());
        payload.put("expired_recovered", summary.expiredRecovered());
        payload.put("processing_recovered", summary.processingRecovered());
        payload.put("orphan_jobs_recovered", summary.orphanJobsRecovered());
        payload.put("failed_items", summary.failedItems());
        payload.put("inspected", summary.inspected());
        traceLogger.info("unlock_sweep_summary", payload);
        return summary;
    }

    private void recoverExpiredReservations(int batchSize, SweepMode mode, String traceId, SweepCounters counters) {
        List<Unlock> expired = reservationStore.findExpiredReserved(batchSize);
        counters.expiredCandidates = expired.size();
        for (Unlock unlock : expired) {
            try {
                if (recover(unlock, "reservation_expired", UnlockLedgerKeys.RESERVATION_EXPIRED_REFUND,
                        EXPIRED_RECOVERED_CODE, "Recovered expired unlock reservation.", mode, traceId)) {
                    counters.expiredRecovered++;
                }
            } catch (RuntimeException ex) {
                counters.failedItems++;
                log.warn("Sweep failed to recover expired unlock {}: {}", unlock.getId(), ex.getMessage(), ex);
            }
        }
    }

    private void recoverStaleProcessing(int batchSize, SweepMode mode, String traceId, SweepCounters counters) {
        List<Unlock> processing = reservationStore.listProcessing(Math.min(MAX_BATCH_SIZE, batchSize * 3));
        counters.processingCandidates = processing.size();
        if (processing.isEmpty()) {
            return;
        }

        Set<UUID> jobIds = processing.stream()
                .map(Unlock::getJobId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, IngestionJob> jobsById = jobLeaseStore.findByIds(jobIds).stream()
                .collect(Collectors.toMap(IngestionJob::getId, Function.identity(), (a, b) -> a));

        LocalDateTime now = LocalDateTime.now(clock);
        for (Unlock unlock : processing) {
            String reason = staleReason(unlock, jobsById, now);
            if (reason == null) {
                continue;
            }
            try {
                if (recover(unlock, reason, UnlockLedgerKeys.PROCESSING_STALE_REFUND, PROCESSING_RECOVERED_CODE,
                        "Recovered stale processing unlock (" + reason + ").", mode, traceId)) {
                    counters.processingRecovered++;
                }
            } catch (RuntimeException ex) {
                counters.failedItems++;
                log.warn("Sweep failed to recover processing unlock {}: {}", unlock.getId(), ex.getMessage(), ex);
            }
        }
    }

    private void recoverOrphanJobs(int batchSize, long staleMs, LocalDateTime startedAt, SweepMode mode,
                                   String traceId, SweepCounters counters) {
        LocalDateTime staleBefore = startedAt.minus(Duration.ofMillis(staleMs));
        List<IngestionJob> running = jobLeaseStore.listRunningStartedBefore(
                unlockProperties.getGenerationScope(), staleBefore, batchSize);
        counters.runningJobs = running.size();
        if (running.isEmpty()) {
            return;
        }

        List<UUID> runningIds = running.stream().map(IngestionJob::getId).toList();
        Map<UUID, Long> activeLinks = reservationStore.countActiveLinksForJobs(runningIds);
        List<UUID> orphanIds = runningIds.stream()
                .filter(id -> activeLinks.getOrDefault(id, 0L) == 0L)
                .toList();
        if (orphanIds.isEmpty()) {
            return;
        }

        try {
            counters.orphanJobsRecovered = jobLeaseStore.markFailed(orphanIds, ORPHAN_JOB_CODE,
                    "Recovered running unlock job with no active unlock rows.");
        } catch (RuntimeException ex) {
            counters.failedItems += orphanIds.size();
            log.warn("Sweep failed to fail {} orphan job(s): {}", orphanIds.size(), ex.getMessage(), ex);
            return;
        }

        if (sweepProperties.isDryLogs() && counters.orphanJobsRecovered > 0) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("trace_id", traceId);
            payload.put("mode", mode.name().toLowerCase(Locale.ROOT));
            payload.put("orphan_job_ids", orphanIds);
            payload.put("recovered", counters.orphanJobsRecovered);
            traceLogger.info("unlock_sweep_recovered_orphan_jobs", payload);
        }
    }

    /**
     * Refunds the hold (idempotently, keyed on the hold) and then releases the row if it has not
     * moved since it was read. Refund first: a crash in between leaves the row for the next sweep,
     * whose refund replays as a no-op.
     *
     * @return true when this sweep released the row
     */
    private boolean recover(Unlock unlock, String reason, String refundReason, String errorCode,
                            String errorMessage, SweepMode mode, String traceId) {
        BigDecimal heldAmount = shouldRefund(unlock) ? heldAmount(unlock) : null;
        if (heldAmount != null && heldAmount.signum() > 0) {
            LedgerContext context = new LedgerContext(
                    unlock.getId(),
                    unlock.getSourceItemId(),
                    unlock.getSourcePageId(),
                    traceId,
                    Map.of("source", "unlock_reliability_sweep", "reason", reason)
            );
            creditLedgerService.refundReservation(new LedgerRequest(
                    unlock.getReservedByUserId(),
                    heldAmount,
                    UnlockLedgerKeys.refundKey(unlock.getId(), unlock.getReservedLedgerId()),
                    refundReason,
                    context
            ));
        }

        boolean released = reservationStore.failUnlockIfUnchanged(unlock, errorCode, errorMessage).isPresent();
        if (!released) {
            log.info("Unlock {} changed while being recovered ({}); leaving it as is", unlock.getId(), reason);
            return false;
        }

        if (sweepProperties.isDryLogs()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("trace_id", traceId);
            payload.put("unlock_id", unlock.getId());
            payload.put("job_id", unlock.getJobId());
            payload.put("mode", mode.name().toLowerCase(Locale.ROOT));
            payload.put("reason", reason);
            payload.put("source_item_id", unlock.getSourceItemId());
            payload.put("source_page_id", unlock.getSourcePageId());
            traceLogger.info("unlock_sweep_recovered_item", payload);
        }
        return true;
    }

    static String staleReason(Unlock unlock, Map<UUID, IngestionJob> jobsById, LocalDateTime now) {
        if (unlock.isReservationExpired(now)) {
            return "reservation_expired";
        }
        if (unlock.getJobId() == null) {
            return "missing_job_id";
        }
        IngestionJob job = jobsById.get(unlock.getJobId());
        if (job == null) {
            return "job_missing";
        }
        if (job.getStatus() != JobStatus.RUNNING) {
            return "job_" + job.getStatus().name().toLowerCase(Locale.ROOT);
        }
        return null;
    }

    private static boolean shouldRefund(Unlock unlock) {
        return unlock.getReservedByUserId() != null && unlock.getReservedLedgerId() != null;
    }

    /**
     * What the hold actually debited. The price column can move after the hold was placed.
     */
    private BigDecimal heldAmount(Unlock unlock) {
        return creditLedgerService.findHeldAmount(unlock.getReservedLedgerId())
                .orElseGet(() -> {
                    log.warn("Hold {} of unlock {} is not in the ledger; refunding the recorded cost {}",
                            unlock.getReservedLedgerId(), unlock.getId(), unlock.getEstimatedCost());
                    return unlock.getEstimatedCost();
                });
    }

    private boolean inCooldown(long minIntervalMs) {
        LocalDateTime last = lastCompletedAt.get();
        if (last == null) {
            return false;
        }
        return Duration.between(last, LocalDateTime.now(clock)).toMillis() < minIntervalMs;
    }

    private static SweepSummary await(CompletableFuture<SweepSummary> running) {
        try {
            return running.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    private static final class SweepCounters {
        int expiredCandidates;
        int processingCandidates;
        int runningJobs;
        int expiredRecovered;
        int processingRecovered;
        int orphanJobsRecovered;
        int failedItems;
    }
}
