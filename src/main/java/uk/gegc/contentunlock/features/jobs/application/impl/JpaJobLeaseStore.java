package uk.gegc.contentunlock.features.jobs.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.contentunlock.features.jobs.application.JobLeaseStore;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.jobs.domain.model.JobStatus;
import uk.gegc.contentunlock.features.jobs.infra.repository.IngestionJobRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Job queue on the {@code ingestion_jobs} table. Claims are conditional updates on
 * {@code status = QUEUED}, so two workers racing for a job cannot both win it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaJobLeaseStore implements JobLeaseStore {

    private static final int DEFAULT_MAX_ATTEMPTS = 1;
    private static final int MAX_ERROR_CODE_LENGTH = 120;
    private static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private final IngestionJobRepository jobRepository;
    private final Clock clock;

    @Override
    @Transactional
    public IngestionJob enqueue(String scope, UUID requestedByUserId, String payloadJson, String traceId) {
        LocalDateTime now = LocalDateTime.now(clock);
        IngestionJob job = new IngestionJob();
        job.setScope(scope);
        job.setStatus(JobStatus.QUEUED);
        job.setRequestedByUserId(requestedByUserId);
        job.setPayloadJson(payloadJson);
        job.setTraceId(traceId);
        job.setAttempts(0);
        job.setMaxAttempts(DEFAULT_MAX_ATTEMPTS);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        IngestionJob saved = jobRepository.save(job);
        log.debug("Enqueued job {} in scope {}", saved.getId(), scope);
        return saved;
    }

    @Override
    @Transactional
    public List<IngestionJob> claim(Collection<String> scopes, int maxJobs, String workerId, int leaseSeconds) {
        if (scopes == null || scopes.isEmpty() || maxJobs <= 0) {
            return List.of();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime leaseUntil = now.plusSeconds(Math.max(1, leaseSeconds));

        // Over-fetch so jobs lost to other workers don't leave this batch short
        List<UUID> candidates = jobRepository.findQueuedIds(scopes, PageRequest.of(0, maxJobs * 2));
        List<UUID> claimed = new ArrayList<>();
        for (UUID id : candidates) {
            if (claimed.size() >= maxJobs) {
                break;
            }
            if (jobRepository.claimIfQueued(id, workerId, leaseUntil, now) == 1) {
                claimed.add(id);
            }
        }
        if (claimed.isEmpty()) {
            return List.of();
        }
        log.debug("Worker {} claimed {} job(s)", workerId, claimed.size());
        return jobRepository.findAllById(claimed);
    }

    @Override
    @Transactional
    public boolean touchLease(UUID jobId, String workerId, int leaseSeconds) {
        LocalDateTime now = LocalDateTime.now(clock);
        return jobRepository.touchLease(jobId, workerId, now.plusSeconds(Math.max(1, leaseSeconds)), now) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<IngestionJob> findByIds(Collection<UUID> jobIds) {
        if (jobIds == null || jobIds.isEmpty()) {
            return List.of();
        }
        return jobRepository.findAllById(jobIds);
    }

    @Override
    @Transactional(readOnly = true)
    public List<IngestionJob> listRunningStartedBefore(String scope, LocalDateTime startedBefore, int limit) {
        return jobRepository.findRunningStartedBefore(scope, startedBefore, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional
    public int markFailed(Collection<UUID> jobIds, String errorCode, String errorMessage) {
        if (jobIds == null || jobIds.isEmpty()) {
            return 0;
        }
        return jobRepository.transitionAll(jobIds, JobStatus.RUNNING, JobStatus.FAILED,
                truncate(errorCode, MAX_ERROR_CODE_LENGTH), truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH),
                LocalDateTime.now(clock));
    }

    @Override
    @Transactional
    public boolean complete(UUID jobId, String workerId) {
        return jobRepository.finishRunning(jobId, workerId, JobStatus.SUCCEEDED, null, null,
                LocalDateTime.now(clock)) == 1;
    }

    @Override
    @Transactional
    public boolean fail(UUID jobId, String workerId, String errorCode, String errorMessage) {
        return jobRepository.finishRunning(jobId, workerId, JobStatus.FAILED,
                truncate(errorCode, MAX_ERROR_CODE_LENGTH), truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH),
                LocalDateTime.now(clock)) == 1;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
