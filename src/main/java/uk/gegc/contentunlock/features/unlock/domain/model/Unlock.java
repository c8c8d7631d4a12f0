package uk.gegc.contentunlock.features.unlock.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Unlock state for one source item. All transitions after insert are conditional updates in
 * {@code UnlockRepository}; {@code version} is the compare-and-set token and is bumped by each of them.
 */
@Entity
@Table(name = "unlocks", indexes = {
        @Index(name = "idx_unlocks_status_expires", columnList = "status, reservation_expires_at"),
        @Index(name = "idx_unlocks_job_id", columnList = "job_id")
})
@Getter
@Setter
public class Unlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_item_id", nullable = false, unique = true, updatable = false, length = 200)
    private String sourceItemId;

    @Column(name = "source_page_id", length = 200)
    private String sourcePageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private UnlockStatus status;

    @Column(name = "estimated_cost", nullable = false, precision = 12, scale = 3)
    private BigDecimal estimatedCost;

    @Column(name = "reserved_by_user_id")
    private UUID reservedByUserId;

    @Column(name = "reservation_expires_at")
    private LocalDateTime reservationExpiresAt;

    @Column(name = "reserved_ledger_id")
    private UUID reservedLedgerId;

    @Column(name = "blueprint_id")
    private UUID blueprintId;

    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "last_error_code", length = 120)
    private String lastErrorCode;

    @Column(name = "last_error_message", length = 500)
    private String lastErrorMessage;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isReservationExpired(LocalDateTime now) {
        return reservationExpiresAt != null && !reservationExpiresAt.isAfter(now);
    }
}
