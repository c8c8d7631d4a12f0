package uk.gegc.contentunlock.features.credits.application.impl;

import uk.gegc.contentunlock.features.credits.domain.model.CreditWallet;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Continuous refill arithmetic. Balances are kept at three decimals and clamped to
 * {@code [0, capacity]}.
 */
final class WalletRefill {

    static final int BALANCE_SCALE = 3;

    private WalletRefill() {
    }

    static BigDecimal round3(BigDecimal value) {
        return value.setScale(BALANCE_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal clamp(BigDecimal value, BigDecimal capacity) {
        return round3(value.max(BigDecimal.ZERO).min(capacity));
    }

    /**
     * Balance after accruing refill from {@code lastRefillAt} to {@code now}.
     * A clock that went backwards accrues nothing.
     */
    static BigDecimal refilledBalance(CreditWallet wallet, LocalDateTime now) {
        BigDecimal balance = wallet.getBalance();
        LocalDateTime last = wallet.getLastRefillAt();
        if (last == null || !now.isAfter(last)) {
            return clamp(balance, wallet.getCapacity());
        }
        long elapsedMillis = Duration.between(last, now).toMillis();
        BigDecimal elapsedSeconds = BigDecimal.valueOf(elapsedMillis).movePointLeft(3);
        BigDecimal accrued = elapsedSeconds.multiply(wallet.getRefillRatePerSec());
        return clamp(balance.add(accrued), wallet.getCapacity());
    }

    static long secondsToFull(BigDecimal balance, BigDecimal capacity, BigDecimal refillRatePerSec) {
        BigDecimal remaining = capacity.subtract(balance).max(BigDecimal.ZERO);
        if (remaining.signum() == 0 || refillRatePerSec.signum() <= 0) {
            return 0L;
        }
        return remaining.divide(refillRatePerSec, 0, RoundingMode.CEILING).longValue();
    }
}
