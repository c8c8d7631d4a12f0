package uk.gegc.contentunlock.features.credits.api.dto;

import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntryType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record LedgerEntryDto(
        UUID id,
        UUID userId,
        LedgerEntryType entryType,
        BigDecimal amount,
        BigDecimal settledAmount,
        BigDecimal balanceAfter,
        String reasonCode,
        String idempotencyKey,
        UUID unlockId,
        String sourceItemId,
        String sourcePageId,
        String contextJson,
        LocalDateTime createdAt
) {}
