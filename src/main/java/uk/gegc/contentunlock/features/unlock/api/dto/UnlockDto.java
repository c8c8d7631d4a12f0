package uk.gegc.contentunlock.features.unlock.api.dto;

import uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record UnlockDto(
        UUID id,
        String sourceItemId,
        String sourcePageId,
        UnlockStatus status,
        BigDecimal estimatedCost,
        UUID reservedByUserId,
        LocalDateTime reservationExpiresAt,
        UUID reservedLedgerId,
        UUID blueprintId,
        UUID jobId,
        String lastErrorCode,
        String lastErrorMessage,
        long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
