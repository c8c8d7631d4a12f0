package uk.gegc.contentunlock.features.unlock.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.contentunlock.features.unlock.application.SweepMode;
import uk.gegc.contentunlock.features.unlock.application.SweepRequest;
import uk.gegc.contentunlock.features.unlock.application.SweepSummary;
import uk.gegc.contentunlock.features.unlock.application.UnlockReliabilitySweepService;
import uk.gegc.contentunlock.features.unlock.application.UnlockTraceLogger;

/**
 * Runs the reliability sweep on a fixed delay. The sweep's own cooldown still applies, so a
 * delay shorter than {@code unlock.sweep.min-interval-ms} just produces skipped runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UnlockSweepScheduler {

    private final UnlockReliabilitySweepService sweepService;

    @Scheduled(fixedDelayString = "${unlock.sweep.fixed-delay-ms:60000}",
            initialDelayString = "${unlock.sweep.initial-delay-ms:30000}")
    public void sweep() {
        try {
            SweepSummary summary = sweepService.runSweep(
                    SweepRequest.of(SweepMode.CRON, false, UnlockTraceLogger.newTraceId()));
            if (summary.skipped()) {
                log.debug("Scheduled unlock sweep skipped: {}", summary.skipReason());
            }
        } catch (Exception e) {
            log.error("Error during scheduled unlock sweep", e);
        }
    }
}
