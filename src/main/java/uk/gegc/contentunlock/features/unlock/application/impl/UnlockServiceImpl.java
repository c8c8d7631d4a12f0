package uk.gegc.contentunlock.features.unlock.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.application.HoldResult;
import uk.gegc.contentunlock.features.credits.application.LedgerContext;
import uk.gegc.contentunlock.features.credits.application.LedgerRequest;
import uk.gegc.contentunlock.features.jobs.application.JobLeaseStore;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.unlock.application.GenerationJobPayload;
import uk.gegc.contentunlock.features.unlock.application.ReserveOutcome;
import uk.gegc.contentunlock.features.unlock.application.SubscriberCountProvider;
import uk.gegc.contentunlock.features.unlock.application.UnlockLedgerKeys;
import uk.gegc.contentunlock.features.unlock.application.UnlockMetricsService;
import uk.gegc.contentunlock.features.unlock.application.UnlockPricing;
import uk.gegc.contentunlock.features.unlock.application.UnlockProperties;
import uk.gegc.contentunlock.features.unlock.application.UnlockReliabilitySweepService;
import uk.gegc.contentunlock.features.unlock.application.UnlockRequestResult;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.application.UnlockService;
import uk.gegc.contentunlock.features.unlock.application.UnlockTraceLogger;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class UnlockServiceImpl implements UnlockService {

    static final String INSUFFICIENT_CREDITS_CODE = "INSUFFICIENT_CREDITS";

    private final UnlockReservationStore reservationStore;
    private final CreditLedgerService creditLedgerService;
    private final JobLeaseStore jobLeaseStore;
    private final SubscriberCountProvider subscriberCountProvider;
    private final UnlockReliabilitySweepService sweepService;
    private final UnlockProperties unlockProperties;
    private final UnlockTraceLogger traceLogger;
    private final UnlockMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Executor sweepExecutor;

    public UnlockServiceImpl(UnlockReservationStore reservationStore,
                             CreditLedgerService creditLedgerService,
                             JobLeaseStore jobLeaseStore,
                             SubscriberCountProvider subscriberCountProvider,
                             UnlockReliabilitySweepService sweepService,
                             UnlockProperties unlockProperties,
                             UnlockTraceLogger traceLogger,
                             UnlockMetricsService metricsService,
                             ObjectMapper objectMapper,
                             @Qualifier("sweepTaskExecutor") Executor sweepExecutor) {
        this.reservationStore = reservationStore;
        this.creditLedgerService = creditLedgerService;
        this.jobLeaseStore = jobLeaseStore;
        this.subscriberCountProvider = subscriberCountProvider;
        this.sweepService = sweepService;
        this.unlockProperties = unlockProperties;
        this.traceLogger = traceLogger;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.sweepExecutor = sweepExecutor;
    }

    @Override
    public UnlockRequestResult requestUnlock(UUID userId, String sourceItemId, String sourcePageId, String traceId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        String trace = UnlockTraceLogger.ensureTraceId(traceId);
        try {
            return doRequestUnlock(userId, sourceItemId, sourcePageId, trace);
        } finally {
            triggerOpportunisticSweep(trace);
        }
    }

    private UnlockRequestResult doRequestUnlock(UUID userId, String sourceItemId, String sourcePageId, String traceId) {
        long subscribers = Math.max(0L, subscriberCountProvider.countActiveSubscribers(sourcePageId));
        BigDecimal cost = UnlockPricing.computeUnlockCost(subscribers);

        Unlock unlock = reservationStore.ensureUnlock(sourceItemId, sourcePageId, cost);
        ReserveOutcome outcome = reservationStore.reserve(unlock, userId, cost, unlockProperties.getReservationSeconds());
        outcome.reclaimedReservation().ifPresent(reclaimed -> refundReclaimed(reclaimed, traceId));

        metricsService.incrementReserveOutcome(outcome.state(), outcome.reservedNow());
        Map<String, Object> reservePayload = basePayload(traceId, outcome.unlock(), userId);
        reservePayload.put("state", outcome.state().name());
        reservePayload.put("reserved_now", outcome.reservedNow());
        reservePayload.put("estimated_cost", cost);
        reservePayload.put("subscribers", subscribers);
        reservePayload.put("reclaimed", outcome.reclaimed() != null);
        traceLogger.info("unlock_reserve_outcome", reservePayload);

        return switch (outcome.state()) {
            case READY -> new UnlockRequestResult(UnlockRequestResult.State.READY, outcome.unlock(), null, null, traceId);
            case IN_PROGRESS ->
                    new UnlockRequestResult(UnlockRequestResult.State.IN_PROGRESS, outcome.unlock(), null, null, traceId);
            case RESERVED -> outcome.reservedNow()
                    ? holdAndEnqueue(outcome.unlock(), userId, traceId)
                    : new UnlockRequestResult(UnlockRequestResult.State.RESERVED, outcome.unlock(), null, null, traceId);
        };
    }

    private UnlockRequestResult holdAndEnqueue(Unlock reserved, UUID userId, String traceId) {
        BigDecimal amount = reserved.getEstimatedCost();
        HoldResult hold = creditLedgerService.reserveCredits(new LedgerRequest(
                userId,
                amount,
                UnlockLedgerKeys.holdKey(reserved.getId(), userId, reserved.getVersion()),
                UnlockLedgerKeys.HOLD_REASON,
                LedgerContext.forUnlock(reserved.getId(), reserved.getSourceItemId(), reserved.getSourcePageId(), traceId)
        ));

        if (!hold.ok()) {
            Unlock released = reservationStore.failUnlockIfUnchanged(reserved, INSUFFICIENT_CREDITS_CODE,
                            "Insufficient credits: required " + hold.required())
                    .orElseGet(() -> reservationStore.findById(reserved.getId()).orElse(reserved));
            Map<String, Object> payload = basePayload(traceId, released, userId);
            payload.put("required", hold.required());
            payload.put("balance", hold.wallet() != null ? hold.wallet().balance() : null);
            traceLogger.warn("unlock_insufficient_credits", payload);
            return new UnlockRequestResult(UnlockRequestResult.State.INSUFFICIENT_CREDITS, released, null,
                    hold.wallet(), traceId);
        }

        Unlock current = reserved;
        if (hold.ledgerId() != null) {
            Optional<Unlock> attached = reservationStore.attachReservationLedger(
                    reserved.getId(), userId, hold.ledgerId(), hold.amount());
            if (attached.isEmpty()) {
                refundUnattachedHold(reserved, userId, hold, traceId);
                Unlock latest = reservationStore.findById(reserved.getId()).orElse(reserved);
                return new UnlockRequestResult(UnlockRequestResult.State.IN_PROGRESS, latest, null, hold.wallet(), traceId);
            }
            current = attached.get();
        }

        GenerationJobPayload jobPayload = new GenerationJobPayload(
                current.getId(),
                userId,
                hold.ledgerId(),
                hold.amount(),
                current.getSourceItemId(),
                current.getSourcePageId(),
                traceId
        );
        IngestionJob job = jobLeaseStore.enqueue(unlockProperties.getGenerationScope(), userId,
                toJson(jobPayload), traceId);

        Map<String, Object> payload = basePayload(traceId, current, userId);
        payload.put("job_id", job.getId());
        payload.put("ledger_id", hold.ledgerId());
        payload.put("amount", hold.amount());
        payload.put("hold_replayed", hold.replayed());
        payload.put("credits_bypassed", hold.status() == HoldResult.Status.BYPASSED);
        traceLogger.info("unlock_hold_placed", payload);

        return new UnlockRequestResult(UnlockRequestResult.State.RESERVED, current, job.getId(), hold.wallet(), traceId);
    }

    /**
     * The previous holder's reservation expired and this request released it; give the credits back.
     * The row no longer references that hold, so no sweep will ever refund it if this fails.
     */
    private void refundReclaimed(Unlock reclaimed, String traceId) {
        if (reclaimed.getReservedByUserId() == null || reclaimed.getReservedLedgerId() == null) {
            return;
        }
        String key = UnlockLedgerKeys.refundKey(reclaimed.getId(), reclaimed.getReservedLedgerId());
        try {
            BigDecimal amount = creditLedgerService.findHeldAmount(reclaimed.getReservedLedgerId())
                    .orElseGet(() -> {
                        log.warn("Reclaimed hold {} of unlock {} is not in the ledger; refunding the recorded cost {}",
                                reclaimed.getReservedLedgerId(), reclaimed.getId(), reclaimed.getEstimatedCost());
                        return reclaimed.getEstimatedCost();
                    });
            if (amount == null || amount.signum() <= 0) {
                return;
            }
            creditLedgerService.refundReservation(new LedgerRequest(
                    reclaimed.getReservedByUserId(),
                    amount,
                    key,
                    UnlockLedgerKeys.RESERVATION_RECLAIMED_REFUND,
                    new LedgerContext(reclaimed.getId(), reclaimed.getSourceItemId(), reclaimed.getSourcePageId(),
                            traceId, Map.of("source", "unlock_reserve_reclaim"))
            ));
        } catch (RuntimeException ex) {
            log.error("Failed to refund reclaimed hold {} of user {} (key {}); needs a manual refund",
                    reclaimed.getReservedLedgerId(), reclaimed.getReservedByUserId(), key, ex);
            Map<String, Object> payload = basePayload(traceId, reclaimed, reclaimed.getReservedByUserId());
            payload.put("ledger_id", reclaimed.getReservedLedgerId());
            payload.put("refund_key", key);
            payload.put("error", ex.getMessage());
            traceLogger.warn("unlock_reclaim_refund_failed", payload);
        }
    }

    private void refundUnattachedHold(Unlock reserved, UUID userId, HoldResult hold, String traceId) {
        creditLedgerService.refundReservation(new LedgerRequest(
                userId,
                hold.amount(),
                UnlockLedgerKeys.refundKey(reserved.getId(), hold.ledgerId()),
                UnlockLedgerKeys.ATTACH_FAILED_REFUND,
                new LedgerContext(reserved.getId(), reserved.getSourceItemId(), reserved.getSourcePageId(),
                        traceId, Map.of("source", "unlock_attach_failed"))
        ));
        Map<String, Object> payload = basePayload(traceId, reserved, userId);
        payload.put("ledger_id", hold.ledgerId());
        payload.put("amount", hold.amount());
        traceLogger.warn("unlock_attach_failed_refunded", payload);
    }

    private void triggerOpportunisticSweep(String traceId) {
        if (!unlockProperties.isOpportunisticSweep()) {
            return;
        }
        try {
            sweepExecutor.execute(() -> {
                try {
                    sweepService.runSweepIfDue(traceId);
                } catch (Exception e) {
                    log.warn("Opportunistic unlock sweep failed (trace {})", traceId, e);
                }
            });
        } catch (RuntimeException e) {
            log.debug("Opportunistic unlock sweep not scheduled: {}", e.getMessage());
        }
    }

    private String toJson(GenerationJobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize generation job payload", e);
        }
    }

    private static Map<String, Object> basePayload(String traceId, Unlock unlock, UUID userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("trace_id", traceId);
        payload.put("unlock_id", unlock.getId());
        payload.put("user_id", userId);
        payload.put("source_item_id", unlock.getSourceItemId());
        payload.put("source_page_id", unlock.getSourcePageId());
        payload.put("status", unlock.getStatus() != null ? unlock.getStatus().name() : null);
        return payload;
    }
}
