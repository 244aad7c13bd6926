package uk.gegc.learnhub.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://learnhub.dev/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== State Errors ====================
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Purchase Errors ====================
    public static final URI INVALID_PURCHASE = URI.create(BASE_URL + "/invalid-purchase");
    public static final URI PAYMENT_ALREADY_VERIFIED = URI.create(BASE_URL + "/payment-already-verified");
    public static final URI PURCHASE_NOT_PENDING = URI.create(BASE_URL + "/purchase-not-pending");
    public static final URI INVALID_PAYMENT_SIGNATURE = URI.create(BASE_URL + "/invalid-payment-signature");
    public static final URI WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/webhook-invalid-signature");
    public static final URI WEBHOOK_MALFORMED_PAYLOAD = URI.create(BASE_URL + "/webhook-malformed-payload");
    public static final URI PAYMENT_GATEWAY_ERROR = URI.create(BASE_URL + "/payment-gateway-error");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
