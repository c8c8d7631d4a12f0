package uk.gegc.contentunlock.features.provider.domain.exception;

import lombok.Getter;

/**
 * The provider's circuit is open (or a recovery probe is already in flight) and fail-fast
 * mode is on. Callers should retry after {@link #getRetryAfterSeconds()}.
 */
@Getter
public class ProviderDegradedException extends RuntimeException {

    public static final String CODE = "PROVIDER_DEGRADED";

    private final String providerKey;
    private final long retryAfterSeconds;

    public ProviderDegradedException(String providerKey, long retryAfterSeconds) {
        super("Provider temporarily degraded. Retry in ~" + Math.max(1, retryAfterSeconds) + "s.");
        this.providerKey = providerKey;
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public String getCode() {
        return CODE;
    }
}
