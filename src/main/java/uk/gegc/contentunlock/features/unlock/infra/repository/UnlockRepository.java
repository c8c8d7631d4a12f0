package uk.gegc.contentunlock.features.unlock.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;
import uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Unlock persistence. Every write is a single conditional update returning the number of rows it
 * touched, so callers learn whether their transition won.
 */
public interface UnlockRepository extends JpaRepository<Unlock, UUID> {

    Optional<Unlock> findBySourceItemId(String sourceItemId);

    List<Unlock> findBySourceItemIdIn(Collection<String> sourceItemIds);

    List<Unlock> findByStatusOrderByUpdatedAtAsc(UnlockStatus status, Pageable pageable);

    @Query("""
        select u from Unlock u
        where u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.RESERVED
          and u.reservationExpiresAt is not null
          and u.reservationExpiresAt < :now
        order by u.reservationExpiresAt asc
    """)
    List<Unlock> findExpiredReserved(@Param("now") LocalDateTime now, Pageable pageable);

    @Query("""
        select u.jobId, count(u) from Unlock u
        where u.jobId in :jobIds
          and u.status in (uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.RESERVED,
                           uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.PROCESSING)
        group by u.jobId
    """)
    List<Object[]> countActiveByJobIds(@Param("jobIds") Collection<UUID> jobIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.estimatedCost = :cost,
               u.sourcePageId = :sourcePageId,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.version = :expectedVersion
    """)
    int updatePricing(@Param("id") UUID id,
                      @Param("expectedVersion") long expectedVersion,
                      @Param("cost") BigDecimal cost,
                      @Param("sourcePageId") String sourcePageId,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.RESERVED,
               u.reservedByUserId = :userId,
               u.reservationExpiresAt = :expiresAt,
               u.reservedLedgerId = null,
               u.estimatedCost = :cost,
               u.lastErrorCode = null,
               u.lastErrorMessage = null,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.version = :expectedVersion
           and u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.AVAILABLE
    """)
    int reserveIfAvailable(@Param("id") UUID id,
                           @Param("expectedVersion") long expectedVersion,
                           @Param("userId") UUID userId,
                           @Param("expiresAt") LocalDateTime expiresAt,
                           @Param("cost") BigDecimal cost,
                           @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.AVAILABLE,
               u.reservedByUserId = null,
               u.reservationExpiresAt = null,
               u.reservedLedgerId = null,
               u.jobId = null,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.version = :expectedVersion
    """)
    int releaseIfUnchanged(@Param("id") UUID id,
                           @Param("expectedVersion") long expectedVersion,
                           @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.reservedLedgerId = :ledgerId,
               u.estimatedCost = :amount,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.reservedByUserId = :userId
           and u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.RESERVED
    """)
    int attachLedger(@Param("id") UUID id,
                     @Param("userId") UUID userId,
                     @Param("ledgerId") UUID ledgerId,
                     @Param("amount") BigDecimal amount,
                     @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.PROCESSING,
               u.jobId = :jobId,
               u.reservationExpiresAt = :processingExpiresAt,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.reservedByUserId = :userId
           and u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.RESERVED
           and u.reservationExpiresAt > :now
    """)
    int markProcessing(@Param("id") UUID id,
                       @Param("userId") UUID userId,
                       @Param("jobId") UUID jobId,
                       @Param("processingExpiresAt") LocalDateTime processingExpiresAt,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.READY,
               u.blueprintId = :blueprintId,
               u.jobId = :jobId,
               u.reservedByUserId = null,
               u.reservationExpiresAt = null,
               u.reservedLedgerId = null,
               u.lastErrorCode = null,
               u.lastErrorMessage = null,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
    """)
    int complete(@Param("id") UUID id,
                 @Param("blueprintId") UUID blueprintId,
                 @Param("jobId") UUID jobId,
                 @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.READY,
               u.blueprintId = :blueprintId,
               u.jobId = :jobId,
               u.reservedByUserId = null,
               u.reservationExpiresAt = null,
               u.reservedLedgerId = null,
               u.lastErrorCode = null,
               u.lastErrorMessage = null,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.version = :expectedVersion
    """)
    int completeIfUnchanged(@Param("id") UUID id,
                            @Param("expectedVersion") long expectedVersion,
                            @Param("blueprintId") UUID blueprintId,
                            @Param("jobId") UUID jobId,
                            @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.AVAILABLE,
               u.reservedByUserId = null,
               u.reservationExpiresAt = null,
               u.reservedLedgerId = null,
               u.jobId = null,
               u.lastErrorCode = :errorCode,
               u.lastErrorMessage = :errorMessage,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
    """)
    int fail(@Param("id") UUID id,
             @Param("errorCode") String errorCode,
             @Param("errorMessage") String errorMessage,
             @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Unlock u
           set u.status = uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus.AVAILABLE,
               u.reservedByUserId = null,
               u.reservationExpiresAt = null,
               u.reservedLedgerId = null,
               u.jobId = null,
               u.lastErrorCode = :errorCode,
               u.lastErrorMessage = :errorMessage,
               u.updatedAt = :now,
               u.version = u.version + 1
         where u.id = :id
           and u.version = :expectedVersion
    """)
    int failIfUnchanged(@Param("id") UUID id,
                        @Param("expectedVersion") long expectedVersion,
                        @Param("errorCode") String errorCode,
                        @Param("errorMessage") String errorMessage,
                        @Param("now") LocalDateTime now);
}
