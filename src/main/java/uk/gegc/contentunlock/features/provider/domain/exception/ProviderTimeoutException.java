package uk.gegc.contentunlock.features.provider.domain.exception;

import lombok.Getter;

@Getter
public class ProviderTimeoutException extends RuntimeException {

    private final String providerKey;
    private final long timeoutMs;

    public ProviderTimeoutException(String providerKey, long timeoutMs) {
        super("Provider " + providerKey + " call timed out after " + timeoutMs + "ms");
        this.providerKey = providerKey;
        this.timeoutMs = timeoutMs;
    }
}
