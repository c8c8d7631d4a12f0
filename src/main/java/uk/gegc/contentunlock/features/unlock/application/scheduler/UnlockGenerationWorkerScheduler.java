package uk.gegc.contentunlock.features.unlock.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.contentunlock.features.unlock.application.impl.UnlockGenerationWorker;

/**
 * Polls the generation queue. Each poll handles one claimed batch on the scheduler thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "unlock.worker.enabled", havingValue = "true", matchIfMissing = true)
public class UnlockGenerationWorkerScheduler {

    private final UnlockGenerationWorker worker;

    @Scheduled(fixedDelayString = "${unlock.worker.poll-delay-ms:2000}")
    public void poll() {
        try {
            int claimed = worker.pollOnce();
            if (claimed > 0) {
                log.debug("Worker {} processed {} generation job(s)", worker.getWorkerId(), claimed);
            }
        } catch (Exception e) {
            log.warn("UnlockGenerationWorkerScheduler: error while polling generation jobs", e);
        }
    }
}
