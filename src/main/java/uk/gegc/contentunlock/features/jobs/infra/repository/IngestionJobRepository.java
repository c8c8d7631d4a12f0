package uk.gegc.contentunlock.features.jobs.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.contentunlock.features.jobs.domain.model.IngestionJob;
import uk.gegc.contentunlock.features.jobs.domain.model.JobStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface IngestionJobRepository extends JpaRepository<IngestionJob, UUID> {

    @Query("""
        select j.id from IngestionJob j
        where j.scope in :scopes
          and j.status = uk.gegc.contentunlock.features.jobs.domain.model.JobStatus.QUEUED
        order by j.createdAt asc
    """)
    List<UUID> findQueuedIds(@Param("scopes") Collection<String> scopes, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update IngestionJob j
           set j.status = uk.gegc.contentunlock.features.jobs.domain.model.JobStatus.RUNNING,
               j.workerId = :workerId,
               j.leaseExpiresAt = :leaseExpiresAt,
               j.lastHeartbeatAt = :now,
               j.startedAt = :now,
               j.attempts = j.attempts + 1,
               j.updatedAt = :now
         where j.id = :id
           and j.status = uk.gegc.contentunlock.features.jobs.domain.model.JobStatus.QUEUED
    """)
    int claimIfQueued(@Param("id") UUID id,
                      @Param("workerId") String workerId,
                      @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update IngestionJob j
           set j.leaseExpiresAt = :leaseExpiresAt,
               j.lastHeartbeatAt = :now,
               j.updatedAt = :now
         where j.id = :id
           and j.workerId = :workerId
           and j.status = uk.gegc.contentunlock.features.jobs.domain.model.JobStatus.RUNNING
    """)
    int touchLease(@Param("id") UUID id,
                   @Param("workerId") String workerId,
                   @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
                   @Param("now") LocalDateTime now);

    @Query("""
        select j from IngestionJob j
        where j.scope = :scope
          and j.status = uk.gegc.contentunlock.features.jobs.domain.model.JobStatus.RUNNING
          and j.startedAt < :startedBefore
        order by j.startedAt asc
    """)
    List<IngestionJob> findRunningStartedBefore(@Param("scope") String scope,
                                                @Param("startedBefore") LocalDateTime startedBefore,
                                                Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update IngestionJob j
           set j.status = :to,
               j.errorCode = :errorCode,
               j.errorMessage = :errorMessage,
               j.finishedAt = :now,
               j.updatedAt = :now
         where j.id in :ids
           and j.status = :from
    """)
    int transitionAll(@Param("ids") Collection<UUID> ids,
                      @Param("from") JobStatus from,
                      @Param("to") JobStatus to,
                      @Param("errorCode") String errorCode,
                      @Param("errorMessage") String errorMessage,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update IngestionJob j
           set j.status = :to,
               j.errorCode = :errorCode,
               j.errorMessage = :errorMessage,
               j.finishedAt = :now,
               j.leaseExpiresAt = null,
               j.updatedAt = :now
         where j.id = :id
           and j.workerId = :workerId
           and j.status = uk.gegc.contentunlock.features.jobs.domain.model.JobStatus.RUNNING
    """)
    int finishRunning(@Param("id") UUID id,
                      @Param("workerId") String workerId,
                      @Param("to") JobStatus to,
                      @Param("errorCode") String errorCode,
                      @Param("errorMessage") String errorMessage,
                      @Param("now") LocalDateTime now);
}
