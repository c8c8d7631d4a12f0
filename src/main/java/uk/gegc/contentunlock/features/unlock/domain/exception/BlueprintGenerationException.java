package uk.gegc.contentunlock.features.unlock.domain.exception;

import lombok.Getter;

/**
 * Permanent generation failure. Not retried; the worker records {@code errorCode} on the unlock.
 */
@Getter
public class BlueprintGenerationException extends RuntimeException {

    private final String errorCode;

    public BlueprintGenerationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
