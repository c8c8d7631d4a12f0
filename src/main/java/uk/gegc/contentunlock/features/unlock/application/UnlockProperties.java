package uk.gegc.contentunlock.features.unlock.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Unlock flow configuration (reservation windows and the generation worker).
 */
@Configuration
@ConfigurationProperties(prefix = "unlock")
@Validated
@Data
public class UnlockProperties {

    /**
     * How long a reservation holds the unlock before it may be reclaimed. Never below 30 seconds.
     */
    @Min(30)
    private int reservationSeconds = 300;

    /**
     * How long a worker may hold an unlock in PROCESSING before it counts as expired.
     */
    @Min(30)
    private int processingWindowSeconds = 300;

    /**
     * Job scope used for blueprint generation jobs.
     */
    @NotBlank
    private String generationScope = "source_item_unlock_generation";

    /**
     * Circuit breaker key for the blueprint generator.
     */
    @NotBlank
    private String providerKey = "llm";

    /**
     * Whether an unlock request may trigger a reliability sweep when one is due.
     */
    private boolean opportunisticSweep = true;

    @Valid
    private Worker worker = new Worker();

    @Data
    public static class Worker {
        private boolean enabled = true;

        /**
         * Worker id written to claimed jobs. Generated when blank.
         */
        private String workerId;

        @Min(1)
        @Max(50)
        private int batchSize = 2;

        @Min(10)
        @Max(3600)
        private int leaseSeconds = 120;

        /**
         * Delay between two polls of the generation queue.
         */
        @Min(100)
        private long pollDelayMs = 2_000L;
    }
}
