package uk.gegc.contentunlock.features.credits.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only credit ledger row. {@code amount} is the signed balance delta the entry
 * requested: negative for holds, positive for refunds and for the released part of a settle.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
        @Index(name = "idx_ledger_user_created", columnList = "user_id, created_at")
})
@Getter
@Setter
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false, length = 200)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false, length = 16)
    private LedgerEntryType entryType;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 3)
    private BigDecimal amount;

    @Column(name = "settled_amount", updatable = false, precision = 12, scale = 3)
    private BigDecimal settledAmount;

    @Column(name = "balance_after", updatable = false, precision = 12, scale = 3)
    private BigDecimal balanceAfter;

    @Column(name = "reason_code", nullable = false, updatable = false, length = 120)
    private String reasonCode;

    @Column(name = "unlock_id", updatable = false)
    private UUID unlockId;

    @Column(name = "source_item_id", updatable = false, length = 200)
    private String sourceItemId;

    @Column(name = "source_page_id", updatable = false, length = 200)
    private String sourcePageId;

    @Column(name = "context_json", updatable = false, length = 4000)
    private String contextJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
