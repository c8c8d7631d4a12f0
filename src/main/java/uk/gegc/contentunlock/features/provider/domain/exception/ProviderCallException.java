package uk.gegc.contentunlock.features.provider.domain.exception;

import lombok.Getter;

/**
 * A provider call failed with a retryable error on every allowed attempt.
 * The last failure is the cause.
 */
@Getter
public class ProviderCallException extends RuntimeException {

    private final String providerKey;
    private final int attempts;

    public ProviderCallException(String providerKey, int attempts, Throwable cause) {
        super("Provider " + providerKey + " failed after " + attempts + " attempt(s): "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.providerKey = providerKey;
        this.attempts = attempts;
    }
}
