package uk.gegc.contentunlock.features.unlock.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.contentunlock.BaseUnitTest;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.application.HoldResult;
import uk.gegc.contentunlock.features.credits.application.LedgerRequest;
import uk.gegc.contentunlock.features.credits.application.WalletSnapshot;
import uk.gegc.contentunlock.features.jobs.application.JobLeaseStore;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.unlock.application.GenerationJobPayload;
import uk.gegc.contentunlock.features.unlock.application.ReserveOutcome;
import uk.gegc.contentunlock.features.unlock.application.SubscriberCountProvider;
import uk.gegc.contentunlock.features.unlock.application.UnlockLedgerKeys;
import uk.gegc.contentunlock.features.unlock.application.UnlockMetricsService;
import uk.gegc.contentunlock.features.unlock.application.UnlockProperties;
import uk.gegc.contentunlock.features.unlock.application.UnlockReliabilitySweepService;
import uk.gegc.contentunlock.features.unlock.application.UnlockRequestResult;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.application.UnlockTraceLogger;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;
import uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("UnlockServiceImpl")
class UnlockServiceImplTest extends BaseUnitTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);
    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID UNLOCK_ID = UUID.randomUUID();
    private static final UUID LEDGER_ID = UUID.randomUUID();
    private static final UUID JOB_ID = UUID.randomUUID();
    private static final String TRACE = "ut_request";
    private static final BigDecimal COST = new BigDecimal("0.333");

    @Mock
    private UnlockReservationStore reservationStore;

    @Mock
    private CreditLedgerService creditLedgerService;

    @Mock
    private JobLeaseStore jobLeaseStore;

    @Mock
    private SubscriberCountProvider subscriberCountProvider;

    @Mock
    private UnlockReliabilitySweepService sweepService;

    @Mock
    private UnlockTraceLogger traceLogger;

    @Mock
    private UnlockMetricsService metricsService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private UnlockProperties unlockProperties;
    private UnlockServiceImpl service;

    @BeforeEach
    void setUp() {
        unlockProperties = new UnlockProperties();
        service = new UnlockServiceImpl(
                reservationStore,
                creditLedgerService,
                jobLeaseStore,
                subscriberCountProvider,
                sweepService,
                unlockProperties,
                traceLogger,
                metricsService,
                objectMapper,
                Runnable::run
        );
    }

    @Nested
    @DisplayName("without a fresh reservation")
    class WithoutReservation {

        @Test
        @DisplayName("a ready unlock is returned as is and nothing is charged")
        void readyUnlock() {
            Unlock ready = unlock(UnlockStatus.READY, 7L);
            ready.setBlueprintId(UUID.randomUUID());
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.READY, ready, false, null));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.READY);
            assertThat(result.unlock()).isSameAs(ready);
            assertThat(result.traceId()).isEqualTo(TRACE);
            verifyNoInteractions(creditLedgerService, jobLeaseStore);
            verify(metricsService).incrementReserveOutcome(ReserveOutcome.State.READY, false);
            verify(traceLogger).info(eq("unlock_reserve_outcome"), anyMap());
        }

        @Test
        @DisplayName("someone else's reservation is reported as in progress")
        void inProgress() {
            Unlock held = unlock(UnlockStatus.PROCESSING, 4L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, held, false, null));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.IN_PROGRESS);
            assertThat(result.jobId()).isNull();
            verifyNoInteractions(creditLedgerService, jobLeaseStore);
        }

        @Test
        @DisplayName("repeating a request for one's own reservation charges nothing new")
        void ownReservationRepeated() {
            Unlock held = unlock(UnlockStatus.RESERVED, 2L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.RESERVED, held, false, null));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.RESERVED);
            assertThat(result.unlock()).isSameAs(held);
            assertThat(result.jobId()).isNull();
            verifyNoInteractions(creditLedgerService, jobLeaseStore);
        }

        @Test
        @DisplayName("requires a user and triggers nothing without one")
        void requiresUser() {
            assertThatThrownBy(() -> service.requestUnlock(null, "item-1", "page-1", TRACE))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(reservationStore, sweepService);
        }
    }

    @Nested
    @DisplayName("with a fresh reservation")
    class FreshReservation {

        @Test
        @DisplayName("holds credits, attaches the hold and enqueues a generation job")
        void holdsAttachesEnqueues() throws Exception {
            Unlock reserved = unlock(UnlockStatus.RESERVED, 1L);
            Unlock attached = unlock(UnlockStatus.RESERVED, 2L);
            attached.setReservedLedgerId(LEDGER_ID);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.RESERVED, reserved, true, null));
            when(creditLedgerService.reserveCredits(any())).thenReturn(HoldResult.held(LEDGER_ID, COST, wallet("9.667"), false));
            when(reservationStore.attachReservationLedger(UNLOCK_ID, USER_ID, LEDGER_ID, COST)).thenReturn(Optional.of(attached));
            when(jobLeaseStore.enqueue(eq(unlockProperties.getGenerationScope()), eq(USER_ID), anyString(), eq(TRACE)))
                    .thenReturn(job());

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.RESERVED);
            assertThat(result.jobId()).isEqualTo(JOB_ID);
            assertThat(result.unlock()).isSameAs(attached);
            assertThat(result.wallet().balance()).isEqualByComparingTo("9.667");

            ArgumentCaptor<LedgerRequest> hold = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).reserveCredits(hold.capture());
            assertThat(hold.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.holdKey(UNLOCK_ID, USER_ID, 1L));
            assertThat(hold.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.HOLD_REASON);
            assertThat(hold.getValue().amount()).isEqualByComparingTo(COST);

            ArgumentCaptor<String> payloadJson = ArgumentCaptor.forClass(String.class);
            verify(jobLeaseStore).enqueue(anyString(), eq(USER_ID), payloadJson.capture(), eq(TRACE));
            GenerationJobPayload payload = objectMapper.readValue(payloadJson.getValue(), GenerationJobPayload.class);
            assertThat(payload.unlockId()).isEqualTo(UNLOCK_ID);
            assertThat(payload.holdLedgerId()).isEqualTo(LEDGER_ID);
            assertThat(payload.amount()).isEqualByComparingTo(COST);
            assertThat(payload.traceId()).isEqualTo(TRACE);

            verify(traceLogger).info(eq("unlock_hold_placed"), anyMap());
        }

        @Test
        @DisplayName("insufficient credits release the reservation and enqueue nothing")
        void insufficientCredits() {
            Unlock reserved = unlock(UnlockStatus.RESERVED, 1L);
            Unlock released = unlock(UnlockStatus.AVAILABLE, 2L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.RESERVED, reserved, true, null));
            when(creditLedgerService.reserveCredits(any())).thenReturn(HoldResult.insufficient(COST, wallet("0.100")));
            when(reservationStore.failUnlockIfUnchanged(reserved, UnlockServiceImpl.INSUFFICIENT_CREDITS_CODE,
                    "Insufficient credits: required 0.333")).thenReturn(Optional.of(released));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.INSUFFICIENT_CREDITS);
            assertThat(result.unlock()).isSameAs(released);
            assertThat(result.wallet().balance()).isEqualByComparingTo("0.1");
            verify(reservationStore, never()).attachReservationLedger(any(), any(), any(), any());
            verifyNoInteractions(jobLeaseStore);
            verify(traceLogger).warn(eq("unlock_insufficient_credits"), anyMap());
        }

        @Test
        @DisplayName("a hold that cannot be attached is refunded right away")
        void attachFailureRefunds() {
            Unlock reserved = unlock(UnlockStatus.RESERVED, 1L);
            Unlock reclaimedByOther = unlock(UnlockStatus.RESERVED, 3L);
            reclaimedByOther.setReservedByUserId(UUID.randomUUID());
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.RESERVED, reserved, true, null));
            when(creditLedgerService.reserveCredits(any())).thenReturn(HoldResult.held(LEDGER_ID, COST, wallet("9.667"), false));
            when(reservationStore.attachReservationLedger(UNLOCK_ID, USER_ID, LEDGER_ID, COST)).thenReturn(Optional.empty());
            when(reservationStore.findById(UNLOCK_ID)).thenReturn(Optional.of(reclaimedByOther));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.IN_PROGRESS);
            assertThat(result.unlock()).isSameAs(reclaimedByOther);

            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.refundKey(UNLOCK_ID, LEDGER_ID));
            assertThat(refund.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.ATTACH_FAILED_REFUND);
            verifyNoInteractions(jobLeaseStore);
        }

        @Test
        @DisplayName("bypassed credits still enqueue a job, with no hold to attach")
        void bypassEnqueuesWithoutAttach() throws Exception {
            Unlock reserved = unlock(UnlockStatus.RESERVED, 1L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.RESERVED, reserved, true, null));
            when(creditLedgerService.reserveCredits(any())).thenReturn(HoldResult.bypassed(COST, wallet("10.000")));
            when(jobLeaseStore.enqueue(anyString(), eq(USER_ID), anyString(), eq(TRACE))).thenReturn(job());

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.RESERVED);
            verify(reservationStore, never()).attachReservationLedger(any(), any(), any(), any());
            ArgumentCaptor<String> payloadJson = ArgumentCaptor.forClass(String.class);
            verify(jobLeaseStore).enqueue(anyString(), eq(USER_ID), payloadJson.capture(), eq(TRACE));
            assertThat(objectMapper.readValue(payloadJson.getValue(), GenerationJobPayload.class).holdLedgerId()).isNull();
        }
    }

    @Nested
    @DisplayName("reclaimed reservations")
    class Reclaimed {

        @Test
        @DisplayName("the previous holder's credits are refunded")
        void refundsPreviousHolder() {
            UUID previousUser = UUID.randomUUID();
            UUID previousHold = UUID.randomUUID();
            Unlock reclaimed = unlock(UnlockStatus.RESERVED, 5L);
            reclaimed.setReservedByUserId(previousUser);
            reclaimed.setReservedLedgerId(previousHold);
            reclaimed.setEstimatedCost(new BigDecimal("0.500"));
            Unlock inProgress = unlock(UnlockStatus.RESERVED, 7L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, inProgress, false, reclaimed));

            service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().userId()).isEqualTo(previousUser);
            assertThat(refund.getValue().amount()).isEqualByComparingTo("0.5");
            assertThat(refund.getValue().idempotencyKey()).isEqualTo(UnlockLedgerKeys.refundKey(UNLOCK_ID, previousHold));
            assertThat(refund.getValue().reasonCode()).isEqualTo(UnlockLedgerKeys.RESERVATION_RECLAIMED_REFUND);
        }

        @Test
        @DisplayName("the refund is the amount the previous hold debited")
        void refundsHeldAmount() {
            UUID previousHold = UUID.randomUUID();
            Unlock reclaimed = unlock(UnlockStatus.RESERVED, 5L);
            reclaimed.setReservedByUserId(UUID.randomUUID());
            reclaimed.setReservedLedgerId(previousHold);
            reclaimed.setEstimatedCost(new BigDecimal("0.050"));
            Unlock inProgress = unlock(UnlockStatus.RESERVED, 7L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, inProgress, false, reclaimed));
            when(creditLedgerService.findHeldAmount(previousHold)).thenReturn(Optional.of(new BigDecimal("1.000")));

            service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            ArgumentCaptor<LedgerRequest> refund = ArgumentCaptor.forClass(LedgerRequest.class);
            verify(creditLedgerService).refundReservation(refund.capture());
            assertThat(refund.getValue().amount()).isEqualByComparingTo("1.000");
        }

        @Test
        @DisplayName("a failed refund is reported but does not fail the request")
        void failedRefundReported() {
            Unlock reclaimed = unlock(UnlockStatus.RESERVED, 5L);
            reclaimed.setReservedByUserId(UUID.randomUUID());
            reclaimed.setReservedLedgerId(UUID.randomUUID());
            Unlock inProgress = unlock(UnlockStatus.RESERVED, 7L);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, inProgress, false, reclaimed));
            when(creditLedgerService.refundReservation(any())).thenThrow(new IllegalStateException("wallet locked"));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.IN_PROGRESS);
            verify(traceLogger).warn(eq("unlock_reclaim_refund_failed"), anyMap());
        }
    }

    @Nested
    @DisplayName("opportunistic sweep")
    class OpportunisticSweep {

        @Test
        @DisplayName("every request offers a sweep with its trace id")
        void triggersSweep() {
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, unlock(UnlockStatus.RESERVED, 1L), false, null));

            service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            verify(sweepService).runSweepIfDue(TRACE);
        }

        @Test
        @DisplayName("a sweep failure never reaches the caller")
        void sweepFailureSwallowedByTask() {
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, unlock(UnlockStatus.RESERVED, 1L), false, null));
            when(sweepService.runSweepIfDue(TRACE)).thenThrow(new IllegalStateException("sweep broke"));

            UnlockRequestResult result = service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            assertThat(result.state()).isEqualTo(UnlockRequestResult.State.IN_PROGRESS);
        }

        @Test
        @DisplayName("is skipped when disabled")
        void disabled() {
            unlockProperties.setOpportunisticSweep(false);
            givenReserveOutcome(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, unlock(UnlockStatus.RESERVED, 1L), false, null));

            service.requestUnlock(USER_ID, "item-1", "page-1", TRACE);

            verifyNoInteractions(sweepService);
        }

        @Test
        @DisplayName("runs even when the request itself fails")
        void runsAfterFailure() {
            when(subscriberCountProvider.countActiveSubscribers("page-1")).thenReturn(3L);
            when(reservationStore.ensureUnlock("item-1", "page-1", COST)).thenThrow(new IllegalStateException("db down"));

            assertThatThrownBy(() -> service.requestUnlock(USER_ID, "item-1", "page-1", TRACE))
                    .isInstanceOf(IllegalStateException.class);
            verify(sweepService).runSweepIfDue(TRACE);
        }
    }

    private void givenReserveOutcome(ReserveOutcome outcome) {
        Unlock available = unlock(UnlockStatus.AVAILABLE, 0L);
        when(subscriberCountProvider.countActiveSubscribers("page-1")).thenReturn(3L);
        when(reservationStore.ensureUnlock("item-1", "page-1", COST)).thenReturn(available);
        when(reservationStore.reserve(available, USER_ID, COST, unlockProperties.getReservationSeconds())).thenReturn(outcome);
    }

    private static Unlock unlock(UnlockStatus status, long version) {
        Unlock unlock = new Unlock();
        unlock.setId(UNLOCK_ID);
        unlock.setSourceItemId("item-1");
        unlock.setSourcePageId("page-1");
        unlock.setStatus(status);
        unlock.setEstimatedCost(COST);
        unlock.setVersion(version);
        if (status == UnlockStatus.RESERVED || status == UnlockStatus.PROCESSING) {
            unlock.setReservedByUserId(USER_ID);
            unlock.setReservationExpiresAt(NOW.plusMinutes(5));
        }
        return unlock;
    }

    private static WalletSnapshot wallet(String balance) {
        return new WalletSnapshot(USER_ID, new BigDecimal(balance), new BigDecimal("10.000"),
                new BigDecimal("0.002778"), NOW, 0L, false);
    }

    private static IngestionJob job() {
        IngestionJob job = new IngestionJob();
        job.setId(JOB_ID);
        return job;
    }
}
