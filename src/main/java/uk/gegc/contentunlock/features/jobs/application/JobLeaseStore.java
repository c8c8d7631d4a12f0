package uk.gegc.contentunlock.features.jobs.application;

import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Job queue with leased claims. Claims are atomic: a QUEUED job is handed to at most one worker.
 */
public interface JobLeaseStore {

    IngestionJob enqueue(String scope, UUID requestedByUserId, String payloadJson, String traceId);

    /**
     * Claims up to {@code maxJobs} queued jobs of the given scopes, oldest first.
     */
    List<IngestionJob> claim(Collection<String> scopes, int maxJobs, String workerId, int leaseSeconds);

    /**
     * Extends the lease of a running job still held by {@code workerId}.
     *
     * @return false when the job is no longer running under this worker
     */
    boolean touchLease(UUID jobId, String workerId, int leaseSeconds);

    List<IngestionJob> findByIds(Collection<UUID> jobIds);

    List<IngestionJob> listRunningStartedBefore(String scope, LocalDateTime startedBefore, int limit);

    /**
     * Fails the given jobs that are still RUNNING; jobs in any other status are left alone.
     *
     * @return number of jobs actually failed
     */
    int markFailed(Collection<UUID> jobIds, String errorCode, String errorMessage);

    boolean complete(UUID jobId, String workerId);

    boolean fail(UUID jobId, String workerId, String errorCode, String errorMessage);
}
