package uk.gegc.contentunlock.features.unlock.application;

import java.util.UUID;

public record BlueprintRequest(
        UUID unlockId,
        String sourceItemId,
        String sourcePageId,
        UUID requestedByUserId,
        String traceId,
        int attempt
) {}
