package uk.gegc.contentunlock.features.credits.application;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of a credit hold. Running out of credits is an expected result, not an exception.
 */
public record HoldResult(
        Status status,
        UUID ledgerId,
        BigDecimal amount,
        BigDecimal required,
        WalletSnapshot wallet,
        boolean replayed
) {
    public enum Status {
        HELD,
        INSUFFICIENT,
        BYPASSED
    }

    public static HoldResult held(UUID ledgerId, BigDecimal amount, WalletSnapshot wallet, boolean replayed) {
        return new HoldResult(Status.HELD, ledgerId, amount, amount, wallet, replayed);
    }

    public static HoldResult insufficient(BigDecimal required, WalletSnapshot wallet) {
        return new HoldResult(Status.INSUFFICIENT, null, BigDecimal.ZERO, required, wallet, false);
    }

    public static HoldResult bypassed(BigDecimal amount, WalletSnapshot wallet) {
        return new HoldResult(Status.BYPASSED, null, amount, amount, wallet, false);
    }

    public boolean ok() {
        return status != Status.INSUFFICIENT;
    }
}
