package uk.gegc.contentunlock.features.unlock.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import uk.gegc.contentunlock.BaseUnitTest;
import uk.gegc.contentunlock.features.credits.api.dto.LedgerEntryDto;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.application.LedgerRequest;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntryType;
import uk.gegc.contentunlock.features.jobs.application.JobLeaseStore;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.jobs.domain.model.JobStatus;
import uk.gegc.contentunlock.features.provider.application.ProviderCircuitService;
import uk.gegc.contentunlock.features.provider.application.ProviderResilienceProperties;
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
import uk.gegc.contentunlock.features.unlock.domain.exception.UnlockNotFoundException;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;
import uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("UnlockGenerationWorker")
class UnlockGenerationWorkerTest extends BaseUnitTest {

    private static final String WORKER_ID = "test-worker";
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);
    private static final UUID UNLOCK_ID = UUID.randomUUID();
    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID HOLD_ID = UUID.randomUUID();
    private static final UUID JOB_ID = UUID.randomUUID();
    private static final UUID BLUEPRINT_ID = UUID.randomUUID();
    private static final BigDecimal AMOUNT = new BigDecimal("0.500");

    @Mock
    private JobLeaseStore jobLeaseStore;

    @Mock
    private UnlockReservationStore reservationStore;

    @Mock
    private CreditLedgerService creditLedgerService;

    @Mock
    private ProviderCircuitService circuitService;

    @Mock
    private BlueprintGenerator blueprintGenerator;

    @Mock
    private UnlockTraceLogger traceLogger;

    @Mock
    private UnlockMetricsService metricsService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private UnlockProperties unlockProperties;
    private UnlockGenerationWorker worker;

    @BeforeEach
    void setUp() {
        unlockProperties = new UnlockProperties();
        unlockProperties.getWorker().setWorkerId(WORKER_ID);
        ProviderRetryExecutor retryExecutor = new ProviderRetryExecutor(
                circuitService, new ProviderResilienceProperties(), Runnable::run) {
            @Override
            protected void sleepBeforeRetry(long delayMs) {
            }
        };
        worker = new UnlockGenerationWorker(
                jobLeaseStore,
                reservationStore,
                creditLedgerService,
                retryExecutor,
                blueprintGenerator,
                unlockProperties,
                traceLogger,
                metricsService,
                objectMapper
        );
    }

    @Nested
    @DisplayName("when generation succeeds")
    class Succeeds {

        @Test
        @DisplayName("claims a batch, completes the unlock, settles the hold and completes the job")
        void settlesAndCompletes() throws Exception {
            when(jobLeaseStore.claim(List.of(unlockProperties.getGenerationScope()), 2, WORKER_ID, 120))
                    .thenReturn(List.of(job(payloadJson(HOLD_ID))));
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            givenCompletes(processing());

            int claimed = worker.pollOnce();

            assertThat(claimed).isEqualTo(1);
            ArgumentCaptor<BlueprintRequest> request = ArgumentCaptor.forClass(BlueprintRequest.class);
            verify(blueprintGenerator).generateBlueprint(request.capture());
            assertThat(request.getValue().unlockId()).isEqualTo(UNLOCK_ID);
            assertThat(request.getValue().requestedByUserId()).isEqualTo(USER_ID);
            assertThat(request.getValue().traceId()).isEqualTo("ut_job");
            assertThat(request.getValue().attempt()).isEqualTo(1);
            verify(jobLeaseStore).touchLease(JOB_ID, WORKER_ID, 120);

            ArgumentCaptor<LedgerRequest> settle = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).settleReservation(settle.capture(), eq(AMOUNT));
            assertThat(settle.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.settleKey(UNLOCK_ID, HOLD_ID));
            assertThat(settle.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.SETTLE_REASON);
            assertThat(settle.getValue().amount()).isEqualByComparingTo(AMOUNT);

            verify(jobLeaseStore).complete(JOB_ID, WORKER_ID);
            verify(metricsService).incrementGenerationSucceeded();
            verify(circuitService).recordProviderSuccess(unlockProperties.getProviderKey());
            verify(traceLogger).info(eq("unlock_generation_succeeded"), anyMap());
        }

        @Test
        @DisplayName("does not settle a hold refunded by a sweep while the row was being completed")
        void skipsSettleAfterRefund() throws Exception {
            Unlock row = processing();
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(row));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            givenCompletes(row);
            when(creditLedgerService.findEntry(UnlockLedgerKeys.refundKey(UNLOCK_ID, HOLD_ID)))
                    .thenReturn(Optional.of(refundEntry()));

            worker.process(job(payloadJson(HOLD_ID)));

            InOrder order = inOrder(reservationStore, creditLedgerService);
            order.verify(reservationStore).completeUnlockIfUnchanged(row, BLUEPRINT_ID, JOB_ID);
            order.verify(creditLedgerService).findEntry(UnlockLedgerKeys.refundKey(UNLOCK_ID, HOLD_ID));
            verify(creditLedgerService, never()).settleReservation(any(), any());
            verify(jobLeaseStore).complete(JOB_ID, WORKER_ID);
        }

        @Test
        @DisplayName("re-reads and retries when the row changes between the read and the completion")
        void retriesCompletionAfterVersionMiss() throws Exception {
            Unlock first = processing();
            Unlock touched = processing();
            touched.setVersion(4L);
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(first));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(first), Optional.of(touched));
            when(reservationStore.completeUnlockIfUnchanged(first, BLUEPRINT_ID, JOB_ID)).thenReturn(Optional.empty());
            when(reservationStore.completeUnlockIfUnchanged(touched, BLUEPRINT_ID, JOB_ID)).thenReturn(Optional.of(ready()));

            worker.process(job(payloadJson(HOLD_ID)));

            verify(creditLedgerService).settleReservation(any(), eq(AMOUNT));
            verify(jobLeaseStore).complete(JOB_ID, WORKER_ID);
        }

        @Test
        @DisplayName("a row the sweep already released is completed with its hold refunded, not settled")
        void releasedRowCompletedWithoutSettle() throws Exception {
            Unlock released = processing();
            released.setStatus(UnlockStatus.AVAILABLE);
            released.setReservedByUserId(null);
            released.setReservedLedgerId(null);
            released.setJobId(null);
            released.setVersion(4L);
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            givenCompletes(released);

            worker.process(job(payloadJson(HOLD_ID)));

            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.refundKey(UNLOCK_ID, HOLD_ID));
            assertThat(refund.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.PROCESSING_STALE_REFUND);
            verify(creditLedgerService, never()).settleReservation(any(), any());
            verify(jobLeaseStore).complete(JOB_ID, WORKER_ID);
        }

        @Test
        @DisplayName("never overwrites a reservation that now belongs to another user")
        void newHolderKeepsRow() throws Exception {
            Unlock otherHolder = processing();
            otherHolder.setStatus(UnlockStatus.RESERVED);
            otherHolder.setReservedByUserId(UUID.randomUUID());
            otherHolder.setReservedLedgerId(UUID.randomUUID());
            otherHolder.setJobId(null);
            otherHolder.setVersion(6L);
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(otherHolder));

            worker.process(job(payloadJson(HOLD_ID)));

            verify(reservationStore, never()).completeUnlockIfUnchanged(any(), any(), any());
            verify(reservationStore, never()).completeUnlock(any(), any(), any());
            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().userId()).isEqualTo(USER_ID);
            assertThat(refund.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.refundKey(UNLOCK_ID, HOLD_ID));
            verify(creditLedgerService, never()).settleReservation(any(), any());
            verify(jobLeaseStore).fail(eq(JOB_ID), eq(WORKER_ID), eq(UnlockGenerationWorker.NOT_RESERVED_CODE), anyString());
            verify(traceLogger).warn(eq("unlock_generation_discarded"), anyMap());
        }

        @Test
        @DisplayName("bypassed credits complete without any ledger write")
        void bypassedCreditsNoSettle() throws Exception {
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            givenCompletes(processing());

            worker.process(job(payloadJson(null)));

            verifyNoInteractions(creditLedgerService);
            verify(jobLeaseStore).complete(JOB_ID, WORKER_ID);
        }
    }

    @Nested
    @DisplayName("when generation fails")
    class Fails {

        @Test
        @DisplayName("refunds the hold, releases the row and fails the job with the generator's code")
        void refundsAndReleases() throws Exception {
            Unlock processing = processing();
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing));
            when(blueprintGenerator.generateBlueprint(any()))
                    .thenThrow(new BlueprintGenerationException("SOURCE_UNREADABLE", "Source item could not be parsed"));
            when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(processing));

            worker.process(job(payloadJson(HOLD_ID)));

            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.refundKey(UNLOCK_ID, HOLD_ID));
            assertThat(refund.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.GENERATION_FAILED_REFUND);

            verify(reservationStore).failUnlockIfUnchanged(processing, "SOURCE_UNREADABLE", "Source item could not be parsed");
            verify(jobLeaseStore).fail(JOB_ID, WORKER_ID, "SOURCE_UNREADABLE", "Source item could not be parsed");
            verify(metricsService).incrementGenerationFailed("SOURCE_UNREADABLE");
            verify(reservationStore, never()).completeUnlockIfUnchanged(any(), any(), any());
            verify(traceLogger).warn(eq("unlock_generation_failed"), anyMap());
        }

        @Test
        @DisplayName("leaves a row that has moved on untouched")
        void rowMovedOn() throws Exception {
            Unlock reclaimed = processing();
            reclaimed.setStatus(UnlockStatus.RESERVED);
            reclaimed.setJobId(null);
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenThrow(new IllegalStateException("bad output"));
            when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(reclaimed));

            worker.process(job(payloadJson(HOLD_ID)));

            verify(creditLedgerService).refundReservation(any());
            verify(reservationStore, never()).failUnlockIfUnchanged(any(), anyString(), anyString());
            verify(jobLeaseStore).fail(JOB_ID, WORKER_ID, UnlockGenerationWorker.GENERATION_FAILED_CODE, "bad output");
        }

        @Test
        @DisplayName("a generator returning no id counts as a failure")
        void nullBlueprint() throws Exception {
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(null);

            worker.process(job(payloadJson(HOLD_ID)));

            verify(jobLeaseStore).fail(eq(JOB_ID), eq(WORKER_ID), eq(UnlockGenerationWorker.GENERATION_FAILED_CODE), anyString());
            verify(creditLedgerService).refundReservation(any());
            verify(reservationStore, never()).completeUnlockIfUnchanged(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("when the job cannot start")
    class CannotStart {

        @Test
        @DisplayName("an expired reservation is refunded and released, and the generator is never called")
        void expiredReservation() throws Exception {
            Unlock stillReserved = processing();
            stillReserved.setStatus(UnlockStatus.RESERVED);
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.empty());
            when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(stillReserved));

            worker.process(job(payloadJson(HOLD_ID)));

            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.RESERVATION_EXPIRED_REFUND);
            verify(reservationStore).failUnlockIfUnchanged(eq(stillReserved), eq(UnlockGenerationWorker.NOT_RESERVED_CODE), anyString());
            verify(jobLeaseStore).fail(eq(JOB_ID), eq(WORKER_ID), eq(UnlockGenerationWorker.NOT_RESERVED_CODE), anyString());
            verify(blueprintGenerator, never()).generateBlueprint(any());
            verify(traceLogger).warn(eq("unlock_generation_skipped"), anyMap());
        }

        @Test
        @DisplayName("an unreadable payload fails the job and touches nothing else")
        void invalidPayload() {
            IngestionJob job = job("{not json");

            worker.process(job);

            verify(jobLeaseStore).fail(eq(JOB_ID), eq(WORKER_ID), eq(UnlockGenerationWorker.INVALID_PAYLOAD_CODE), anyString());
            verifyNoInteractions(reservationStore, creditLedgerService, blueprintGenerator);
        }

        @Test
        @DisplayName("an unexpected error while processing fails that job and keeps polling")
        void unexpectedErrorFailsJob() throws Exception {
            when(jobLeaseStore.claim(anyList(), eq(2), eq(WORKER_ID), eq(120)))
                    .thenReturn(List.of(job(payloadJson(HOLD_ID))));
            when(reservationStore.markProcessing(UNLOCK_ID, USER_ID, JOB_ID)).thenReturn(Optional.of(processing()));
            when(blueprintGenerator.generateBlueprint(any())).thenReturn(BLUEPRINT_ID);
            when(reservationStore.findById(UNLOCK_ID))
                    .thenThrow(new UnlockNotFoundException("Unlock " + UNLOCK_ID + " not found"));

            int claimed = worker.pollOnce();

            assertThat(claimed).isEqualTo(1);
            verify(jobLeaseStore).fail(eq(JOB_ID), eq(WORKER_ID), eq(UnlockGenerationWorker.GENERATION_FAILED_CODE), anyString());
        }
    }

    @Test
    @DisplayName("maps failures to stable error codes")
    void errorCodes() {
        assertThat(UnlockGenerationWorker.errorCodeFor(new BlueprintGenerationException("X_CODE", "x"))).isEqualTo("X_CODE");
        assertThat(UnlockGenerationWorker.errorCodeFor(new ProviderDegradedException("llm", 5))).isEqualTo(ProviderDegradedException.CODE);
        assertThat(UnlockGenerationWorker.errorCodeFor(new ProviderTimeoutException("llm", 1000)))
                .isEqualTo(UnlockGenerationWorker.PROVIDER_TIMEOUT_CODE);
        assertThat(UnlockGenerationWorker.errorCodeFor(new ProviderCallException("llm", 2, new BlueprintGenerationException("Y_CODE", "y"))))
                .isEqualTo("Y_CODE");
        assertThat(UnlockGenerationWorker.errorCodeFor(new ProviderCallException("llm", 2, new RuntimeException("429"))))
                .isEqualTo(UnlockGenerationWorker.PROVIDER_CALL_FAILED_CODE);
        assertThat(UnlockGenerationWorker.errorCodeFor(new IllegalStateException()))
                .isEqualTo(UnlockGenerationWorker.GENERATION_FAILED_CODE);
    }

    @Test
    @DisplayName("generates a worker id when none is configured")
    void generatedWorkerId() {
        UnlockProperties properties = new UnlockProperties();
        UnlockGenerationWorker unnamed = new UnlockGenerationWorker(jobLeaseStore, reservationStore, creditLedgerService,
                null, blueprintGenerator, properties, traceLogger, metricsService, objectMapper);

        assertThat(unnamed.getWorkerId()).startsWith("unlock-worker-").hasSize("unlock-worker-".length() + 8);
        assertThat(worker.getWorkerId()).isEqualTo(WORKER_ID);
    }

    private void givenCompletes(Unlock row) {
        when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(row));
        when(reservationStore.completeUnlockIfUnchanged(row, BLUEPRINT_ID, JOB_ID)).thenReturn(Optional.of(ready()));
    }

    private String payloadJson(UUID holdId) throws Exception {
        return objectMapper.writeValueAsString(new GenerationJobPayload(
                UNLOCK_ID, USER_ID, holdId, AMOUNT, "item-1", "page-1", "ut_job"));
    }

    private static IngestionJob job(String payloadJson) {
        IngestionJob job = new IngestionJob();
        job.setId(JOB_ID);
        job.setScope("source_item_unlock_generation");
        job.setStatus(JobStatus.RUNNING);
        job.setWorkerId(WORKER_ID);
        job.setPayloadJson(payloadJson);
        job.setStartedAt(NOW);
        return job;
    }

    private static Unlock processing() {
        Unlock unlock = new Unlock();
        unlock.setId(UNLOCK_ID);
        unlock.setSourceItemId("item-1");
        unlock.setSourcePageId("page-1");
        unlock.setStatus(UnlockStatus.PROCESSING);
        unlock.setEstimatedCost(AMOUNT);
        unlock.setReservedByUserId(USER_ID);
        unlock.setReservedLedgerId(HOLD_ID);
        unlock.setReservationExpiresAt(NOW.plusMinutes(5));
        unlock.setJobId(JOB_ID);
        unlock.setVersion(3L);
        return unlock;
    }

    private static Unlock ready() {
        Unlock unlock = processing();
        unlock.setStatus(UnlockStatus.READY);
        unlock.setBlueprintId(BLUEPRINT_ID);
        unlock.setReservedByUserId(null);
        unlock.setReservedLedgerId(null);
        unlock.setReservationExpiresAt(null);
        return unlock;
    }

    private static LedgerEntryDto refundEntry() {
        return new LedgerEntryDto(UUID.randomUUID(), USER_ID, LedgerEntryType.REFUND, AMOUNT, null,
                new BigDecimal("5.000"), UnlockLedgerKeys.PROCESSING_STALE_REFUND,
                UnlockLedgerKeys.refundKey(UNLOCK_ID, HOLD_ID), UNLOCK_ID, "item-1", "page-1", null, NOW);
    }
}
