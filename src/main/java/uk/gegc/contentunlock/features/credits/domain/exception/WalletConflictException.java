package uk.gegc.contentunlock.features.credits.domain.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The wallet kept changing underneath every compare-and-set attempt.
 */
@Getter
public class WalletConflictException extends RuntimeException {

    private final UUID userId;
    private final int attempts;

    public WalletConflictException(UUID userId, int attempts) {
        super("Wallet update for user " + userId + " lost " + attempts + " consecutive compare-and-set races");
        this.userId = userId;
        this.attempts = attempts;
    }
}
