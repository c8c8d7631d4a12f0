package uk.gegc.contentunlock.features.credits.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntry;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntryType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey);

    List<LedgerEntry> findByUnlockIdOrderByCreatedAtAsc(UUID unlockId);

    @Query("""
        select e from LedgerEntry e
        where (:userId is null or e.userId = :userId)
          and (:type is null or e.entryType = :type)
          and (:dateFrom is null or e.createdAt >= :dateFrom)
          and (:dateTo is null or e.createdAt <= :dateTo)
        order by e.createdAt desc
    """)
    Page<LedgerEntry> findByFilters(
            @Param("userId") UUID userId,
            @Param("type") LedgerEntryType type,
            @Param("dateFrom") LocalDateTime dateFrom,
            @Param("dateTo") LocalDateTime dateTo,
            Pageable pageable
    );
}
