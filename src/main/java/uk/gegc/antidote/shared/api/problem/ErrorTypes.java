package uk.gegc.antidote.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs used by the billing API.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://antidote.health/docs/errors";

    // ==================== Request Errors ====================
    public static final URI INVALID_INPUT = URI.create(BASE_URL + "/invalid-input");
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Ledger Errors ====================
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== Payment Errors ====================
    public static final URI SIGNATURE_MISMATCH = URI.create(BASE_URL + "/signature-mismatch");
    public static final URI GATEWAY_UNAVAILABLE = URI.create(BASE_URL + "/gateway-unavailable");
    public static final URI PROMO_INVALID = URI.create(BASE_URL + "/promo-invalid");

    // ==================== Dispute Errors ====================
    public static final URI DUPLICATE_DISPUTE = URI.create(BASE_URL + "/duplicate-dispute");
    public static final URI DISPUTE_ALREADY_RESOLVED = URI.create(BASE_URL + "/dispute-already-resolved");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Generic ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
