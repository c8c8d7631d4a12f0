package uk.gegc.contentunlock.features.provider.application;

import uk.gegc.contentunlock.features.provider.domain.exception.ProviderTimeoutException;

import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Per-call retry settings. Values outside the supported ranges are clamped by the executor.
 */
public record ProviderRetryOptions(
        String providerKey,
        int maxAttempts,
        long timeoutMs,
        long baseDelayMs,
        long jitterMs,
        Predicate<Throwable> retryable
) {

    public ProviderRetryOptions {
        if (providerKey == null || providerKey.isBlank()) {
            throw new IllegalArgumentException("providerKey is required");
        }
        if (retryable == null) {
            retryable = ProviderRetryOptions::isTransientError;
        }
    }

    public static ProviderRetryOptions defaults(String providerKey, ProviderResilienceProperties.Retry retry) {
        return new ProviderRetryOptions(providerKey, retry.getMaxAttempts(), retry.getTimeoutMs(),
                retry.getBaseDelayMs(), retry.getJitterMs(), null);
    }

    public ProviderRetryOptions withRetryable(Predicate<Throwable> predicate) {
        return new ProviderRetryOptions(providerKey, maxAttempts, timeoutMs, baseDelayMs, jitterMs, predicate);
    }

    public ProviderRetryOptions withMaxAttempts(int attempts) {
        return new ProviderRetryOptions(providerKey, attempts, timeoutMs, baseDelayMs, jitterMs, retryable);
    }

    public ProviderRetryOptions withTimeoutMs(long timeout) {
        return new ProviderRetryOptions(providerKey, maxAttempts, timeout, baseDelayMs, jitterMs, retryable);
    }

    /**
     * Timeouts, rate limits and connection resets are worth another attempt; anything else is not.
     */
    public static boolean isTransientError(Throwable error) {
        if (error instanceof ProviderTimeoutException || error instanceof TimeoutException) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit")
                || lower.contains("rate_limit")
                || lower.contains("429")
                || lower.contains("too many requests")
                || lower.contains("timeout")
                || lower.contains("timed out")
                || lower.contains("temporarily")
                || lower.contains("econnreset")
                || lower.contains("connection reset")
                || lower.contains("etimedout");
    }
}
