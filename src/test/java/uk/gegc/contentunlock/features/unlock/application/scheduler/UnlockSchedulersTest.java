package uk.gegc.contentunlock.features.unlock.application.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.contentunlock.features.unlock.application.SweepMode;
import uk.gegc.contentunlock.features.unlock.application.SweepRequest;
import uk.gegc.contentunlock.features.unlock.application.SweepSummary;
import uk.gegc.contentunlock.features.unlock.application.UnlockReliabilitySweepService;
import uk.gegc.contentunlock.features.unlock.application.impl.UnlockGenerationWorker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the sweep and worker schedulers
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Unlock schedulers")
class UnlockSchedulersTest {

    @Mock
    private UnlockReliabilitySweepService sweepService;

    @Mock
    private UnlockGenerationWorker worker;

    @Test
    @DisplayName("sweep: runs an unforced CRON sweep with a fresh trace id")
    void sweep_runsCronSweep() {
        when(sweepService.runSweep(any())).thenReturn(SweepSummary.skipped(SweepSummary.SKIP_COOLDOWN, SweepMode.CRON, "t"));

        new UnlockSweepScheduler(sweepService).sweep();

        ArgumentCaptor<SweepRequest> captor = ArgumentCaptor.forClass(SweepRequest.class);
        verify(sweepService).runSweep(captor.capture());
        assertThat(captor.getValue().mode()).isEqualTo(SweepMode.CRON);
        assertThat(captor.getValue().force()).isFalse();
        assertThat(captor.getValue().traceId()).startsWith("ut_");
    }

    @Test
    @DisplayName("sweep: when the sweep throws then does not propagate")
    void sweep_whenServiceThrows_thenDoesNotPropagate() {
        when(sweepService.runSweep(any())).thenThrow(new RuntimeException("Sweep failed"));

        assertThatCode(() -> new UnlockSweepScheduler(sweepService).sweep()).doesNotThrowAnyException();
        verify(sweepService, times(1)).runSweep(any());
    }

    @Test
    @DisplayName("poll: when the worker throws then does not propagate")
    void poll_whenWorkerThrows_thenDoesNotPropagate() {
        when(worker.pollOnce()).thenThrow(new IllegalStateException("database down"));

        assertThatCode(() -> new UnlockGenerationWorkerScheduler(worker).poll()).doesNotThrowAnyException();
        verify(worker, times(1)).pollOnce();
    }
}
