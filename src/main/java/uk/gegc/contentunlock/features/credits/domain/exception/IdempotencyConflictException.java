package uk.gegc.contentunlock.features.credits.domain.exception;

/**
 * An idempotency key was reused for a different kind of ledger operation.
 */
public class IdempotencyConflictException extends RuntimeException {
    public IdempotencyConflictException(String message) {
        super(message);
    }
}
