package uk.gegc.contentunlock.features.provider.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Circuit breaker and retry defaults for upstream providers.
 */
@Configuration
@ConfigurationProperties(prefix = "provider")
@Validated
@Data
public class ProviderResilienceProperties {

    @Valid
    private Circuit circuit = new Circuit();

    @Valid
    private Retry retry = new Retry();

    @Data
    public static class Circuit {
        /**
         * When false the breaker only records outcomes and never rejects calls.
         */
        private boolean failFast = false;

        /**
         * Consecutive failures that open the circuit.
         */
        @Min(1)
        @Max(100)
        private int failureThreshold = 5;

        /**
         * Seconds an open circuit rejects calls before a probe is allowed.
         */
        @Min(5)
        @Max(3600)
        private int cooldownSeconds = 60;

        /**
         * Seconds a half-open probe holds the circuit before another probe may take over.
         */
        @Min(1)
        @Max(3600)
        private int probeLeaseSeconds = 30;
    }

    @Data
    public static class Retry {
        @Min(1)
        @Max(6)
        private int maxAttempts = 2;

        /**
         * Hard limit for a single attempt.
         */
        @Min(1000)
        @Max(180_000)
        private long timeoutMs = 25_000L;

        /**
         * Backoff before retry n is {@code baseDelayMs * n} plus up to {@code jitterMs} of random jitter.
         */
        @Min(50)
        @Max(10_000)
        private long baseDelayMs = 250L;

        @Min(0)
        @Max(5_000)
        private long jitterMs = 200L;
    }
}
