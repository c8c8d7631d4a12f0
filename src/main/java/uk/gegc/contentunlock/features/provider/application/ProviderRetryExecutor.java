package uk.gegc.contentunlock.features.provider.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.contentunlock.features.provider.domain.exception.ProviderCallException;
import uk.gegc.contentunlock.features.provider.domain.exception.ProviderTimeoutException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs provider calls behind the circuit breaker with a hard per-attempt timeout and
 * linear backoff between retryable failures.
 *
 * <p>Each attempt runs on the provider executor and is cancelled (interrupted) when it
 * overruns. Non-retryable errors propagate from the first attempt that raises them;
 * retryable errors that exhaust every attempt surface as {@link ProviderCallException}.
 */
@Slf4j
@Component
public class ProviderRetryExecutor {

    static final int MIN_ATTEMPTS = 1;
    static final int MAX_ATTEMPTS = 6;
    static final long MIN_TIMEOUT_MS = 1_000L;
    static final long MAX_TIMEOUT_MS = 180_000L;
    static final long MIN_BASE_DELAY_MS = 50L;
    static final long MAX_BASE_DELAY_MS = 10_000L;
    static final long MAX_JITTER_MS = 5_000L;

    private final ProviderCircuitService circuitService;
    private final ProviderResilienceProperties properties;
    private final Executor providerExecutor;

    public ProviderRetryExecutor(ProviderCircuitService circuitService,
                                 ProviderResilienceProperties properties,
                                 @Qualifier("providerTaskExecutor") Executor providerExecutor) {
        this.circuitService = circuitService;
        this.properties = properties;
        this.providerExecutor = providerExecutor;
    }

    /**
     * Runs {@code call} with the configured default options for {@code providerKey}.
     */
    public <T> T run(String providerKey, ProviderCall<T> call) {
        return run(ProviderRetryOptions.defaults(providerKey, properties.getRetry()), call);
    }

    public <T> T run(ProviderRetryOptions options, ProviderCall<T> call) {
        String providerKey = options.providerKey();
        int maxAttempts = (int) clamp(options.maxAttempts(), MIN_ATTEMPTS, MAX_ATTEMPTS);
        long timeoutMs = clamp(options.timeoutMs(), MIN_TIMEOUT_MS, MAX_TIMEOUT_MS);

        circuitService.assertProviderAvailable(providerKey);

        Throwable lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T result = runAttempt(providerKey, call, attempt, timeoutMs);
                circuitService.recordProviderSuccess(providerKey);
                if (attempt > 1) {
                    log.info("Provider {} call succeeded on attempt {}/{}", providerKey, attempt, maxAttempts);
                }
                return result;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ProviderCallException(providerKey, attempt, ie);
            } catch (Exception e) {
                lastError = e;
                circuitService.recordProviderFailure(providerKey, describe(e));

                if (!options.retryable().test(e)) {
                    log.warn("Provider {} attempt {}/{} failed with non-retryable error: {}",
                            providerKey, attempt, maxAttempts, describe(e));
                    throw propagate(providerKey, attempt, e);
                }
                if (attempt < maxAttempts) {
                    long delay = calculateBackoffDelay(attempt, options);
                    log.warn("Provider {} attempt {}/{} failed, retrying in {}ms: {}",
                            providerKey, attempt, maxAttempts, delay, describe(e));
                    sleepBeforeRetry(delay);
                }
            }
        }

        log.error("Provider {} call failed after {} attempt(s)", providerKey, maxAttempts);
        throw new ProviderCallException(providerKey, maxAttempts, lastError);
    }

    private <T> T runAttempt(String providerKey, ProviderCall<T> call, int attempt, long timeoutMs)
            throws Exception {
        FutureTask<T> task = new FutureTask<>(() -> call.call(attempt));
        providerExecutor.execute(task);
        try {
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            task.cancel(true);
            throw new ProviderTimeoutException(providerKey, timeoutMs);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw ee;
        }
    }

    /**
     * Linear backoff: {@code baseDelay * attempt} plus random jitter.
     */
    protected long calculateBackoffDelay(int attempt, ProviderRetryOptions options) {
        long baseDelay = clamp(options.baseDelayMs(), MIN_BASE_DELAY_MS, MAX_BASE_DELAY_MS);
        long jitterMs = clamp(options.jitterMs(), 0L, MAX_JITTER_MS);
        long jitter = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L;
        return baseDelay * attempt + jitter;
    }

    /**
     * Sleep between attempts. Overridable so tests can skip the wait.
     */
    protected void sleepBeforeRetry(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry provider call", e);
        }
    }

    private static RuntimeException propagate(String providerKey, int attempt, Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new ProviderCallException(providerKey, attempt, e);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
