package uk.gegc.contentunlock.features.provider.application;

import java.util.Optional;

/**
 * Persistent circuit breaker shared by every process that talks to a provider.
 */
public interface ProviderCircuitService {

    /**
     * Returns normally when a call may proceed.
     *
     * @throws uk.gegc.contentunlock.features.provider.domain.exception.ProviderDegradedException
     *         when fail-fast mode is on and the circuit is open or a probe is in flight
     */
    void assertProviderAvailable(String providerKey);

    void recordProviderSuccess(String providerKey);

    void recordProviderFailure(String providerKey, String errorMessage);

    Optional<CircuitSnapshot> getSnapshot(String providerKey);

    boolean isFailFastEnabled();
}
