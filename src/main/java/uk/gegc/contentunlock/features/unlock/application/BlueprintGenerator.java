package uk.gegc.contentunlock.features.unlock.application;

import java.util.UUID;

/**
 * Produces the derived artifact for a source item. Called through the provider retry
 * executor, so implementations should be safe to run again after a timeout.
 */
public interface BlueprintGenerator {

    /**
     * @return id of the generated blueprint
     * @throws Exception any failure; transient ones are retried by the caller
     */
    UUID generateBlueprint(BlueprintRequest request) throws Exception;
}
