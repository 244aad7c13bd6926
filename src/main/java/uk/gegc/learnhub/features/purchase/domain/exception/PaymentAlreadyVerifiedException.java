package uk.gegc.learnhub.features.purchase.domain.exception;

/**
 * Raised when a client verifies a purchase that is already completed.
 */
public class PaymentAlreadyVerifiedException extends RuntimeException {
    public PaymentAlreadyVerifiedException(String message) {
        super(message);
    }
}
