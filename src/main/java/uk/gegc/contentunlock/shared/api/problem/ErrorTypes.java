package uk.gegc.contentunlock.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the API.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://contentunlock.dev/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI UNLOCK_NOT_FOUND = URI.create(BASE_URL + "/unlock-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI INVALID_REQUEST_BODY = URI.create(BASE_URL + "/invalid-request-body");

    // ==================== Ledger Errors ====================
    public static final URI IDEMPOTENCY_CONFLICT = URI.create(BASE_URL + "/idempotency-conflict");
    public static final URI SETTLE_EXCEEDS_HOLD = URI.create(BASE_URL + "/settle-exceeds-hold");
    public static final URI WALLET_CONFLICT = URI.create(BASE_URL + "/wallet-conflict");

    // ==================== Provider Errors ====================
    public static final URI PROVIDER_DEGRADED = URI.create(BASE_URL + "/provider-degraded");
    public static final URI PROVIDER_CALL_FAILED = URI.create(BASE_URL + "/provider-call-failed");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_ERROR = URI.create(BASE_URL + "/internal-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
