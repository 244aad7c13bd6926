package uk.gegc.learnhub.features.purchase.domain.exception;

/**
 * Raised when a purchase has left the pending state by a path other than a successful payment.
 */
public class PurchaseNotPendingException extends RuntimeException {
    public PurchaseNotPendingException(String message) {
        super(message);
    }
}
