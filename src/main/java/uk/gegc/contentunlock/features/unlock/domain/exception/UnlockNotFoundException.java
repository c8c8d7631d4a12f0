package uk.gegc.contentunlock.features.unlock.domain.exception;

public class UnlockNotFoundException extends RuntimeException {
    public UnlockNotFoundException(String message) {
        super(message);
    }
}
