package uk.gegc.contentunlock.features.credits.application;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record WalletSnapshot(
        UUID userId,
        BigDecimal balance,
        BigDecimal capacity,
        BigDecimal refillRatePerSec,
        LocalDateTime lastRefillAt,
        long secondsToFull,
        boolean bypass
) {}
