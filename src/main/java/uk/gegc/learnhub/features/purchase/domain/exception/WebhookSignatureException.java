package uk.gegc.learnhub.features.purchase.domain.exception;

/**
 * Webhook rejected before any state change because its signature could not be verified.
 */
public class WebhookSignatureException extends RuntimeException {
    public WebhookSignatureException(String message) {
        super(message);
    }
}
