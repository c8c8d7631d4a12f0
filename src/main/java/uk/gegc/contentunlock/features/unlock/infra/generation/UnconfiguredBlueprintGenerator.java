package uk.gegc.contentunlock.features.unlock.infra.generation;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.contentunlock.features.unlock.application.BlueprintGenerator;
import uk.gegc.contentunlock.features.unlock.application.BlueprintRequest;
import uk.gegc.contentunlock.features.unlock.domain.exception.BlueprintGenerationException;

import java.util.UUID;

/**
 * Fallback used when no generator bean is present. Every call fails, so unlocks are refunded.
 */
@Slf4j
public class UnconfiguredBlueprintGenerator implements BlueprintGenerator {

    public static final String ERROR_CODE = "BLUEPRINT_GENERATOR_NOT_CONFIGURED";

    @Override
    public UUID generateBlueprint(BlueprintRequest request) {
        log.warn("No blueprint generator configured; failing unlock {}", request.unlockId());
        throw new BlueprintGenerationException(ERROR_CODE, "No blueprint generator is configured.");
    }
}
