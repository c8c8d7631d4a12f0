package uk.gegc.contentunlock.features.unlock.infra.generation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.contentunlock.features.unlock.application.BlueprintGenerator;
import uk.gegc.contentunlock.features.unlock.application.SubscriberCountProvider;

/**
 * Defaults for the pluggable collaborators. A host application overrides them by
 * declaring its own beans.
 */
@Configuration
public class UnlockCollaboratorsConfig {

    @Bean
    @ConditionalOnMissingBean
    public BlueprintGenerator blueprintGenerator() {
        return new UnconfiguredBlueprintGenerator();
    }

    /**
     * No subscribers means the maximum unlock cost.
     */
    @Bean
    @ConditionalOnMissingBean
    public SubscriberCountProvider subscriberCountProvider() {
        return sourcePageId -> 0L;
    }
}
