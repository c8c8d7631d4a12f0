package uk.gegc.contentunlock.features.provider.application;

import uk.gegc.contentunlock.features.provider.domain.model.CircuitState;

import java.time.LocalDateTime;

public record CircuitSnapshot(
        String providerKey,
        CircuitState state,
        int failureCount,
        LocalDateTime openedAt,
        LocalDateTime cooldownUntil,
        String lastError
) {}
