package uk.gegc.contentunlock.features.unlock.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.application.LedgerContext;
import uk.gegc.contentunlock.features.credits.application.LedgerRequest;
import uk.gegc.contentunlock.features.jobs.application.JobLeaseStore;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.provider.application.ProviderRetryExecutor;
import uk.gegc.contentunlock.features.provider.domain.exception.ProviderCallException;
import uk.gegc.contentunlock.features.provider.domain.exception.ProviderDegradedException;
import uk.gegc.contentunlock.features.provider.domain.exception.ProviderTimeoutException;
import uk.gegc.contentunlock.features.unlock.application.BlueprintGenerator;
import uk.gegc.contentunlock.features.unlock.application.BlueprintRequest;
import uk.gegc.contentunlock.features.unlock.application.GenerationJobPayload;
import uk.gegc.contentunlock.features.unlock.application.UnlockLedgerKeys;
import uk.gegc.contentunlock.features.unlock.application.UnlockMetricsService;
import uk.gegc.contentunlock.features.unlock.application.UnlockProperties;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.application.UnlockTraceLogger;
import uk.gegc.contentunlock.features.unlock.domain.exception.BlueprintGenerationException;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;
import uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Claims blueprint generation jobs and drives each unlock from RESERVED to READY, or back to
 * AVAILABLE with its hold refunded.
 *
 * <p>Refunds use the hold-scoped key, so a refund already issued by the sweep or by a reclaim
 * replays as a no-op here, and a settle is skipped once any refund for the hold exists.
 */
@Slf4j
@Service
public class UnlockGenerationWorker {

    static final String INVALID_PAYLOAD_CODE = "INVALID_JOB_PAYLOAD";
    static final String NOT_RESERVED_CODE = "UNLOCK_NOT_RESERVED";
    static final String GENERATION_FAILED_CODE = "UNLOCK_GENERATION_FAILED";
    static final String PROVIDER_TIMEOUT_CODE = "PROVIDER_TIMEOUT";
    static final String PROVIDER_CALL_FAILED_CODE = "PROVIDER_CALL_FAILED";
    static final int MAX_COMPLETE_ROUNDS = 3;

    private final JobLeaseStore jobLeaseStore;
    private final UnlockReservationStore reservationStore;
    private final CreditLedgerService creditLedgerService;
    private final ProviderRetryExecutor retryExecutor;
    private final BlueprintGenerator blueprintGenerator;
    private final UnlockProperties unlockProperties;
    private final UnlockTraceLogger traceLogger;
    private final UnlockMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final String workerId;

    public UnlockGenerationWorker(JobLeaseStore jobLeaseStore,
                                  UnlockReservationStore reservationStore,
                                  CreditLedgerService creditLedgerService,
                                  ProviderRetryExecutor retryExecutor,
                                  BlueprintGenerator blueprintGenerator,
                                  UnlockProperties unlockProperties,
                                  UnlockTraceLogger traceLogger,
                                  UnlockMetricsService metricsService,
                                  ObjectMapper objectMapper) {
        this.jobLeaseStore = jobLeaseStore;
        this.reservationStore = reservationStore;
        this.creditLedgerService = creditLedgerService;
        this.retryExecutor = retryExecutor;
        this.blueprintGenerator = blueprintGenerator;
        this.unlockProperties = unlockProperties;
        this.traceLogger = traceLogger;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        String configured = unlockProperties.getWorker().getWorkerId();
        this.workerId = configured == null || configured.isBlank()
                ? "unlock-worker-" + UUID.randomUUID().toString().substring(0, 8)
                : configured.trim();
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Claims one batch and processes it on the calling thread.
     *
     * @return number of jobs claimed
     */
    public int pollOnce() {
        UnlockProperties.Worker worker = unlockProperties.getWorker();
        List<IngestionJob> jobs = jobLeaseStore.claim(List.of(unlockProperties.getGenerationScope()),
                worker.getBatchSize(), workerId, worker.getLeaseSeconds());
        for (IngestionJob job : jobs) {
            try {
                process(job);
            } catch (RuntimeException e) {
                log.error("Unlock generation job {} failed unexpectedly", job.getId(), e);
                jobLeaseStore.fail(job.getId(), workerId, GENERATION_FAILED_CODE, describe(e));
            }
        }
        return jobs.size();
    }

    void process(IngestionJob job) {
        Optional<GenerationJobPayload> parsed = parsePayload(job);
        if (parsed.isEmpty()) {
            jobLeaseStore.fail(job.getId(), workerId, INVALID_PAYLOAD_CODE, "Job payload could not be read.");
            return;
        }
        GenerationJobPayload payload = parsed.get();
        String traceId = UnlockTraceLogger.ensureTraceId(payload.traceId());

        Optional<Unlock> processing = reservationStore.markProcessing(payload.unlockId(), payload.userId(), job.getId());
        if (processing.isEmpty()) {
            abandonReservation(job, payload, traceId);
            return;
        }
        Unlock unlock = processing.get();

        UUID blueprintId;
        try {
            blueprintId = retryExecutor.run(unlockProperties.getProviderKey(), attempt -> {
                jobLeaseStore.touchLease(job.getId(), workerId, unlockProperties.getWorker().getLeaseSeconds());
                return blueprintGenerator.generateBlueprint(new BlueprintRequest(
                        unlock.getId(),
                        unlock.getSourceItemId(),
                        unlock.getSourcePageId(),
                        payload.userId(),
                        traceId,
                        attempt
                ));
            });
        } catch (RuntimeException e) {
            onGenerationFailed(job, payload, traceId, e);
            return;
        }
        if (blueprintId == null) {
            onGenerationFailed(job, payload, traceId,
                    new BlueprintGenerationException(GENERATION_FAILED_CODE, "Generator returned no blueprint id."));
            return;
        }
        onGenerationSucceeded(job, payload, traceId, blueprintId);
    }

    private void onGenerationSucceeded(IngestionJob job, GenerationJobPayload payload, String traceId, UUID blueprintId) {
        Optional<Unlock> ready = Optional.empty();
        boolean ownedAtCompletion = false;
        for (int round = 1; round <= MAX_COMPLETE_ROUNDS && ready.isEmpty(); round++) {
            Optional<Unlock> current = reservationStore.findById(payload.unlockId());
            if (current.isEmpty()) {
                break;
            }
            Unlock row = current.get();
            boolean ours = row.getStatus() == UnlockStatus.PROCESSING && Objects.equals(row.getJobId(), job.getId());
            // A released row has no holder; anything else belongs to someone else now
            if (!ours && row.getStatus() != UnlockStatus.AVAILABLE) {
                break;
            }
            ready = reservationStore.completeUnlockIfUnchanged(row, blueprintId, job.getId());
            ownedAtCompletion = ours;
        }
        if (ready.isEmpty()) {
            discardResult(job, payload, traceId, blueprintId);
            return;
        }

        boolean settled = false;
        if (payload.holdLedgerId() != null) {
            if (!ownedAtCompletion) {
                refundHold(payload, traceId, UnlockLedgerKeys.PROCESSING_STALE_REFUND);
            }
            // Checked after completing: a sweep refund may land between reading the row and the write
            if (!ownedAtCompletion || refundExists(payload)) {
                log.warn("Hold {} for unlock {} was refunded before generation finished; not settling",
                        payload.holdLedgerId(), payload.unlockId());
            } else {
                creditLedgerService.settleReservation(new LedgerRequest(
                        payload.userId(),
                        payload.amount(),
                        UnlockLedgerKeys.settleKey(payload.unlockId(), payload.holdLedgerId()),
                        UnlockLedgerKeys.SETTLE_REASON,
                        ledgerContext(payload, traceId, "unlock_generation_worker")
                ), payload.amount());
                settled = true;
            }
        }

        jobLeaseStore.complete(job.getId(), workerId);
        metricsService.incrementGenerationSucceeded();

        Map<String, Object> event = basePayload(payload, traceId, job);
        event.put("blueprint_id", blueprintId);
        event.put("status", ready.get().getStatus().name());
        event.put("settled", settled);
        traceLogger.info("unlock_generation_succeeded", event);
    }

    /**
     * The row moved on to another holder (or vanished) while generating. The result is dropped
     * and this job's hold is refunded.
     */
    private void discardResult(IngestionJob job, GenerationJobPayload payload, String traceId, UUID blueprintId) {
        refundHold(payload, traceId, UnlockLedgerKeys.PROCESSING_STALE_REFUND);
        jobLeaseStore.fail(job.getId(), workerId, NOT_RESERVED_CODE,
                "Unlock moved on before the generated blueprint could be stored.");
        metricsService.incrementGenerationFailed(NOT_RESERVED_CODE);

        Map<String, Object> event = basePayload(payload, traceId, job);
        event.put("blueprint_id", blueprintId);
        event.put("error_code", NOT_RESERVED_CODE);
        traceLogger.warn("unlock_generation_discarded", event);
    }

    private boolean refundExists(GenerationJobPayload payload) {
        return creditLedgerService.findEntry(UnlockLedgerKeys.refundKey(payload.unlockId(), payload.holdLedgerId()))
                .isPresent();
    }

    private void onGenerationFailed(IngestionJob job, GenerationJobPayload payload, String traceId, Exception e) {
        String errorCode = errorCodeFor(e);
        String message = describe(e);

        refundHold(payload, traceId, UnlockLedgerKeys.GENERATION_FAILED_REFUND);

        // Release only if the row is still ours; the sweep may already have moved it on
        reservationStore.findById(payload.unlockId())
                .filter(current -> current.getStatus() == UnlockStatus.PROCESSING
                        && Objects.equals(current.getJobId(), job.getId()))
                .ifPresent(current -> reservationStore.failUnlockIfUnchanged(current, errorCode, message));

        jobLeaseStore.fail(job.getId(), workerId, errorCode, message);
        metricsService.incrementGenerationFailed(errorCode);

        Map<String, Object> event = basePayload(payload, traceId, job);
        event.put("error_code", errorCode);
        event.put("error", message);
        traceLogger.warn("unlock_generation_failed", event);
    }

    /**
     * The reservation expired or was taken over before this job started. The hold is refunded
     * (a no-op if someone already did) and the row is released if it still carries this hold.
     */
    private void abandonReservation(IngestionJob job, GenerationJobPayload payload, String traceId) {
        refundHold(payload, traceId, UnlockLedgerKeys.RESERVATION_EXPIRED_REFUND);

        reservationStore.findById(payload.unlockId())
                .filter(current -> current.getStatus() == UnlockStatus.RESERVED
                        && payload.holdLedgerId() != null
                        && payload.holdLedgerId().equals(current.getReservedLedgerId()))
                .ifPresent(current -> reservationStore.failUnlockIfUnchanged(current, NOT_RESERVED_CODE,
                        "Reservation expired before generation started."));

        jobLeaseStore.fail(job.getId(), workerId, NOT_RESERVED_CODE, "Unlock is no longer reserved by the requesting user.");

        Map<String, Object> event = basePayload(payload, traceId, job);
        event.put("error_code", NOT_RESERVED_CODE);
        traceLogger.warn("unlock_generation_skipped", event);
    }

    private void refundHold(GenerationJobPayload payload, String traceId, String reasonCode) {
        if (payload.holdLedgerId() == null || payload.amount() == null || payload.amount().signum() <= 0) {
            return;
        }
        creditLedgerService.refundReservation(new LedgerRequest(
                payload.userId(),
                payload.amount(),
                UnlockLedgerKeys.refundKey(payload.unlockId(), payload.holdLedgerId()),
                reasonCode,
                ledgerContext(payload, traceId, "unlock_generation_worker")
        ));
    }

    private Optional<GenerationJobPayload> parsePayload(IngestionJob job) {
        if (job.getPayloadJson() == null) {
            log.warn("Job {} has no payload", job.getId());
            return Optional.empty();
        }
        try {
            GenerationJobPayload payload = objectMapper.readValue(job.getPayloadJson(), GenerationJobPayload.class);
            if (payload.unlockId() == null || payload.userId() == null) {
                log.warn("Job {} payload is missing unlockId or userId", job.getId());
                return Optional.empty();
            }
            return Optional.of(payload);
        } catch (JsonProcessingException e) {
            log.warn("Job {} payload is not valid JSON: {}", job.getId(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String errorCodeFor(Throwable e) {
        if (e instanceof BlueprintGenerationException bge) {
            return bge.getErrorCode();
        }
        if (e instanceof ProviderDegradedException) {
            return ProviderDegradedException.CODE;
        }
        if (e instanceof ProviderTimeoutException) {
            return PROVIDER_TIMEOUT_CODE;
        }
        if (e instanceof ProviderCallException pce) {
            return pce.getCause() instanceof BlueprintGenerationException bge
                    ? bge.getErrorCode()
                    : PROVIDER_CALL_FAILED_CODE;
        }
        return GENERATION_FAILED_CODE;
    }

    private static LedgerContext ledgerContext(GenerationJobPayload payload, String traceId, String source) {
        return new LedgerContext(payload.unlockId(), payload.sourceItemId(), payload.sourcePageId(), traceId,
                Map.of("source", source));
    }

    private static Map<String, Object> basePayload(GenerationJobPayload payload, String traceId, IngestionJob job) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("trace_id", traceId);
        event.put("unlock_id", payload.unlockId());
        event.put("user_id", payload.userId());
        event.put("job_id", job.getId());
        event.put("ledger_id", payload.holdLedgerId());
        event.put("amount", payload.amount());
        event.put("source_item_id", payload.sourceItemId());
        return event;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
