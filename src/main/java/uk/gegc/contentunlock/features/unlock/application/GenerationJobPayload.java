package uk.gegc.contentunlock.features.unlock.application;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * JSON payload of a blueprint generation job.
 *
 * @param holdLedgerId null when credits were bypassed
 */
public record GenerationJobPayload(
        UUID unlockId,
        UUID userId,
        UUID holdLedgerId,
        BigDecimal amount,
        String sourceItemId,
        String sourcePageId,
        String traceId
) {}
