package uk.gegc.contentunlock.features.provider.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Shared breaker state for one upstream provider. While HALF_OPEN, {@code cooldownUntil}
 * is the deadline of the single probe that was let through.
 */
@Entity
@Table(name = "provider_circuit_state")
@Getter
@Setter
public class ProviderCircuitState {

    @Id
    @Column(name = "provider_key", nullable = false, updatable = false, length = 64)
    private String providerKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private CircuitState state;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "cooldown_until")
    private LocalDateTime cooldownUntil;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
