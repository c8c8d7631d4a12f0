package uk.gegc.contentunlock.features.provider.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.contentunlock.features.provider.domain.model.CircuitState;
import uk.gegc.contentunlock.features.provider.domain.model.ProviderCircuitState;

import java.time.LocalDateTime;

public interface ProviderCircuitStateRepository extends JpaRepository<ProviderCircuitState, String> {

    /**
     * Replaces the breaker state if the row is still at {@code expectedVersion}.
     *
     * @return 1 when this caller won, 0 when another writer got there first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update ProviderCircuitState c
           set c.state = :state,
               c.failureCount = :failureCount,
               c.openedAt = :openedAt,
               c.cooldownUntil = :cooldownUntil,
               c.lastError = :lastError,
               c.updatedAt = :now,
               c.version = c.version + 1
         where c.providerKey = :providerKey
           and c.version = :expectedVersion
    """)
    int compareAndSet(@Param("providerKey") String providerKey,
                      @Param("state") CircuitState state,
                      @Param("failureCount") int failureCount,
                      @Param("openedAt") LocalDateTime openedAt,
                      @Param("cooldownUntil") LocalDateTime cooldownUntil,
                      @Param("lastError") String lastError,
                      @Param("now") LocalDateTime now,
                      @Param("expectedVersion") long expectedVersion);
}
