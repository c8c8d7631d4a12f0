package uk.gegc.contentunlock.features.credits.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-user credit balance with continuous refill.
 * Balance changes go through {@code CreditWalletRepository.compareAndSetBalance},
 * which bumps {@code version}; the entity itself is only inserted, never saved over.
 */
@Entity
@Table(name = "wallets")
@Getter
@Setter
public class CreditWallet {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "balance", nullable = false, precision = 12, scale = 3)
    private BigDecimal balance;

    @Column(name = "capacity", nullable = false, precision = 12, scale = 3)
    private BigDecimal capacity;

    @Column(name = "refill_rate_per_sec", nullable = false, precision = 12, scale = 6)
    private BigDecimal refillRatePerSec;

    @Column(name = "last_refill_at", nullable = false)
    private LocalDateTime lastRefillAt;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
